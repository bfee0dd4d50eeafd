package com.tony.ladder.model;

public enum SeasonStatus {
    PENDING,  // Début dans le futur
    ACTIVE,   // La fenêtre couvre la date du jour
    EXPIRED   // Fin dans le passé
}
