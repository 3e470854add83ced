package com.watchwise.backend.pairing.service;

import com.watchwise.backend.pairing.config.PairingProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;

/** Digit-uniform numeric codes. */
@Component
public class PairingCodeGenerator {

    private final SecureRandom random;
    private final int length;

    @Autowired
    public PairingCodeGenerator(PairingProperties props) {
        this(new SecureRandom(), props.getCodeLength());
    }

    PairingCodeGenerator(SecureRandom random, int length) {
        if (length <= 0) throw new IllegalArgumentException("code length must be positive");
        this.random = random;
        this.length = length;
    }

    public String next() {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) sb.append((char) ('0' + random.nextInt(10)));
        return sb.toString();
    }

    public int length() { return length; }
}
