package com.watchwise.backend.relationship.controller;

import com.watchwise.backend.auth.security.AuthContext;
import com.watchwise.backend.relationship.dto.RelationshipDtos;
import com.watchwise.backend.relationship.service.RelationshipQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/relationships")
@RequiredArgsConstructor
public class RelationshipController {

    private final RelationshipQueryService service;
    private final AuthContext auth;

    @GetMapping("/children")
    public List<RelationshipDtos.ChildDeviceDto> children() {
        return service.listChildren(auth.requireUserId());
    }

    @GetMapping("/status")
    public RelationshipDtos.PairingStatusDto status() {
        return service.pairingStatus(auth.requireUserId());
    }
}
