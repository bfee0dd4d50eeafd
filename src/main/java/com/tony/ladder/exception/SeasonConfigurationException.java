package com.tony.ladder.exception;

/**
 * Données de saisons incohérentes (plusieurs saisons couvrent le même jour, plusieurs actives...).
 * Jamais résolu automatiquement.
 * <p>
 * Aucune saison couvrant le jour n'est pas une erreur : c'est l'intervalle entre deux saisons,
 * la transition expire la saison terminée et se contente d'un avertissement dans les logs.
 */
public class SeasonConfigurationException extends LadderException {

    public SeasonConfigurationException(String message) {
        super(message);
    }
}
