package com.example.commitment.service.provider.dto;

public record MdmDeploymentRequest(String profileId) {}
