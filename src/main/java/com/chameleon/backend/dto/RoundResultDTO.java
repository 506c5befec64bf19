package com.chameleon.backend.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@JsonInclude(JsonInclude.Include.NON_NULL)
@Data
@AllArgsConstructor
@NoArgsConstructor
public class RoundResultDTO {
    public static final String REASON_NO_CONSENSUS = "no_consensus";
    public static final String REASON_WRONG_ACCUSATION = "wrong_accusation";
    public static final String REASON_CAUGHT = "chameleon_caught";
    public static final String REASON_GUESSED_WORD = "chameleon_guessed_word";
    public static final String REASON_MISSED_WORD = "chameleon_missed_word";

    private boolean success;
    private String secretWord;
    private String chameleonId;
    private String accusedId;
    private String reason;
}
