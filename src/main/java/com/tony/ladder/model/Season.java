package com.tony.ladder.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDate;

@Entity
@Getter @Setter @NoArgsConstructor
public class Season {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private String name; // Ex: "Saison 2026 - Printemps"

    @Column(nullable = false)
    private LocalDate startDate;

    // null = saison ouverte (pas de date de fin)
    private LocalDate endDate;

    // Au plus une saison active à la fois (garanti par SeasonService)
    @Column(nullable = false)
    private boolean active = false;

    public Season(String name, LocalDate startDate, LocalDate endDate) {
        this.name = name;
        this.startDate = startDate;
        this.endDate = endDate;
    }

    /**
     * Vrai si la fenêtre [startDate, endDate] contient le jour donné (bornes incluses).
     */
    public boolean covers(LocalDate day) {
        return !startDate.isAfter(day) && (endDate == null || !endDate.isBefore(day));
    }

    public boolean isEndedBefore(LocalDate day) {
        return endDate != null && endDate.isBefore(day);
    }

    /**
     * Statut calendaire de la saison pour un jour donné, indépendamment du flag {@code active}.
     */
    public SeasonStatus statusOn(LocalDate day) {
        if (startDate.isAfter(day)) return SeasonStatus.PENDING;
        if (isEndedBefore(day)) return SeasonStatus.EXPIRED;
        return SeasonStatus.ACTIVE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Season)) return false;
        return id != null && id.equals(((Season) o).getId());
    }

    @Override
    public int hashCode() {
        return getClass().hashCode();
    }
}
