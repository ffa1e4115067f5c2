package com.example.commitment.service.provider.dto;

public record MdmInvitationRequest(String organizationId, String deviceName, String email) {}
