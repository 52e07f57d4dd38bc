/*
 * Where: Bot matchmaker status API
 * What: Standard error body
 * Why: Every failure response has the same shape
 */
package com.example.botmatch.api;

public record ApiErrorResponse(String code, String message) {}
