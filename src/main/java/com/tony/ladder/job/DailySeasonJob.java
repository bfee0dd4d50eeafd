package com.tony.ladder.job;

import com.tony.ladder.service.SeasonService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class DailySeasonJob {

    private final SeasonService seasonService;

    /**
     * Bascule de saison : expire la saison terminée et active celle qui commence.
     * Fréquence : tous les jours juste après minuit (heure serveur), voir ladder.season.transition-cron.
     * Sans danger si relancé : une saison déjà active ne déclenche jamais une seconde remise à zéro.
     */
    @Scheduled(cron = "${ladder.season.transition-cron:0 5 0 * * *}") // Secondes Minutes Heures Jours Mois JoursSemaine
    public void runSeasonTransition() {
        log.info("⏰ [CRON] Démarrage automatique : transition de saison...");
        try {
            seasonService.runSeasonTransition();
            log.info("✅ [CRON] Transition de saison terminée.");
        } catch (Exception e) {
            log.error("❌ [CRON] Echec de la transition de saison", e);
        }
    }
}
