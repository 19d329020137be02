package com.uno.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChallengeRequest {

    @NotBlank(message = "Challenger id is required")
    private String challengerId;

    @NotBlank(message = "Challenged player id is required")
    private String challengedId;
}
