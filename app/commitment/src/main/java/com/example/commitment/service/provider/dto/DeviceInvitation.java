package com.example.commitment.service.provider.dto;

public record DeviceInvitation(String invitationId, String enrollmentUrl, String invitationCode) {}
