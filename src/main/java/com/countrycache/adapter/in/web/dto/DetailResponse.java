package com.countrycache.adapter.in.web.dto;

/**
 * DTO for single-message responses such as "not found"
 */
public record DetailResponse(String detail) {
}
