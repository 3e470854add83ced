package com.watchwise.backend.pairing.dto;

/**
 * @param alreadyUnlinked true when the link had been unlinked before this call
 */
public record UnpairResponse(boolean success, boolean alreadyUnlinked) {}
