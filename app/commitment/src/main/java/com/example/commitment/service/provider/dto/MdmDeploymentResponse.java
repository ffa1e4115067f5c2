package com.example.commitment.service.provider.dto;

public record MdmDeploymentResponse(String id, String status) {}
