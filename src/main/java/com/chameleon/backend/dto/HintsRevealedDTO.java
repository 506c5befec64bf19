package com.chameleon.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class HintsRevealedDTO {
    // Map<PlayerId, Hint>
    private Map<String, String> hints;
}
