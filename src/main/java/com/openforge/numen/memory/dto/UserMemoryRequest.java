package com.openforge.numen.memory.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Request body for storing a memory in the calling user's namespace.
 *
 * @param memoryType defaults to "preference"
 */
public record UserMemoryRequest(

        @NotBlank(message = "content must not be blank")
        @Size(max = 8000, message = "content must not exceed 8000 characters")
        String content,

        @Size(max = 32, message = "memory_type must not exceed 32 characters")
        String memoryType,

        Map<String, Object> metadata
) {}
