package com.example.commitment.service.provider.dto;

public record MdmInvitationResponse(String id, String enrollmentUrl, String invitationCode) {}
