package uk.gegc.xpeconomy.features.store.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A reading feature that can be bought with spendable XP.
 */
@Entity
@Table(name = "feature_catalog")
@Getter
@Setter
public class FeatureCatalogEntry {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 100)
    private String id;

    @Column(name = "display_name", nullable = false, length = 150)
    private String displayName;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "price", nullable = false)
    private long price;

    @Enumerated(EnumType.STRING)
    @Column(name = "category", nullable = false, length = 30)
    private FeatureCategory category;

    /**
     * Features that should be owned first. Shown to clients, not enforced at purchase.
     */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "feature_prerequisites", joinColumns = @JoinColumn(name = "feature_id"))
    @Column(name = "prerequisite_id", nullable = false, length = 100)
    private Set<String> prerequisites = new LinkedHashSet<>();

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
