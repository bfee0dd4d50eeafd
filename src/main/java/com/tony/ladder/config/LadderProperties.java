package com.tony.ladder.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ladder")
@Data
public class LadderProperties {

    private Elo elo = new Elo();

    @Data
    public static class Elo {
        // Facteur K (volatilité) : identique pour le chemin live et les rejeux, sinon l'historique diverge.
        private int volatility = 32;
    }
}
