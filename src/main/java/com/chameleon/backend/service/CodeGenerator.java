package com.chameleon.backend.service;

import com.chameleon.backend.config.GameProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.function.Predicate;

@Component
@RequiredArgsConstructor
public class CodeGenerator {

    // no 0/O and no 1/I/L
    public static final String ALPHABET = "ABCDEFGHJKMNPQRSTUVWXYZ23456789";

    private final RandomSource random;
    private final GameProperties properties;

    public String generate(Predicate<String> taken) {
        String code;
        do {
            code = candidate();
        } while (taken.test(code));
        return code;
    }

    private String candidate() {
        int length = properties.getRoom().getCodeLength();
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            sb.append(ALPHABET.charAt(random.nextInt(ALPHABET.length())));
        }
        return sb.toString();
    }
}
