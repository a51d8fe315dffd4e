package uk.gegc.xpeconomy.features.store.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.LinkedHashSet;
import java.util.Set;

@Entity
@Table(name = "feature_bundles")
@Getter
@Setter
public class FeatureBundle {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 100)
    private String id;

    @Column(name = "display_name", nullable = false, length = 150)
    private String displayName;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "price", nullable = false)
    private long price;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "bundle_features", joinColumns = @JoinColumn(name = "bundle_id"))
    @Column(name = "feature_id", nullable = false, length = 100)
    private Set<String> featureIds = new LinkedHashSet<>();

    @Column(name = "active", nullable = false)
    private boolean active = true;
}
