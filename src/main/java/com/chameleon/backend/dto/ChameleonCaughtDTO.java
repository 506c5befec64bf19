package com.chameleon.backend.dto;


import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class ChameleonCaughtDTO {
    private String accusedId;
    private String chameleonId;
}
