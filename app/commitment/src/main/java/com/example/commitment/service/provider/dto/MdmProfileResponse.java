package com.example.commitment.service.provider.dto;

public record MdmProfileResponse(String id, String name) {}
