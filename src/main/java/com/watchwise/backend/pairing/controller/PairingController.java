package com.watchwise.backend.pairing.controller;

import com.watchwise.backend.auth.security.AuthContext;
import com.watchwise.backend.pairing.dto.*;
import com.watchwise.backend.pairing.service.PairingCodeService;
import com.watchwise.backend.pairing.service.PairingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/pairing")
@RequiredArgsConstructor
public class PairingController {

    private final PairingCodeService codeService;
    private final PairingService pairingService;
    private final AuthContext auth;

    /** Child device asks for a code to show on screen. */
    @PostMapping("/codes")
    public GenerateCodeResponse generate(@Valid @RequestBody GenerateCodeRequest req) {
        Long childUserId = auth.requireUserId();
        return codeService.generate(childUserId, req.childName(), req.deviceName());
    }

    /** Parent submits the code read off the child's screen. */
    @PostMapping("/submit")
    public PairResponse submit(@RequestBody SubmitCodeRequest req) {
        Long parentUserId = auth.requireUserId();
        return pairingService.pair(req.code(), parentUserId);
    }

    @PostMapping("/relationships/{relationshipId}/unlink")
    public UnpairResponse unlink(@PathVariable Long relationshipId) {
        return pairingService.unpair(relationshipId, auth.requireUserId());
    }
}
