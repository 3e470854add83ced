package com.watchwise.backend.pairing.service;

/** The code row was consumed between our read and our compare-and-set. */
class ConcurrentPairingException extends RuntimeException {
    ConcurrentPairingException(String code) {
        super("pairing code consumed concurrently: " + code);
    }
}
