package com.chameleon.backend.config;

import com.chameleon.backend.model.RoundVariant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Data
@Component
@ConfigurationProperties(prefix = "chameleon")
public class GameProperties {

    private RoomProperties room = new RoomProperties();

    private GameRules game = new GameRules();

    private LivenessProperties liveness = new LivenessProperties();

    private RandomProperties random = new RandomProperties();

    @Data
    public static class RoomProperties {
        /** Maximum seated players. */
        private int capacity = 8;
        /** Players needed before the host may start a round. */
        private int minPlayers = 3;
        private int codeLength = 4;
        /** Longer names are truncated. */
        private int maxNameLength = 20;
    }

    @Data
    public static class GameRules {
        private RoundVariant variant = RoundVariant.ACCUSATION;
        private int maxHintLength = 50;
        private int maxGuessLength = 50;
    }

    @Data
    public static class LivenessProperties {
        private long intervalMs = 30_000L;
    }

    @Data
    public static class RandomProperties {
        /** Fixed seed for reproducible rounds; unset means a fresh seed per process. */
        private Long seed;
    }
}
