package uk.gegc.xpeconomy.features.store.application;

import uk.gegc.xpeconomy.features.store.api.dto.FeatureBundleDto;
import uk.gegc.xpeconomy.features.store.api.dto.FeatureDto;
import uk.gegc.xpeconomy.features.store.api.dto.PurchaseResultDto;

import java.util.List;
import java.util.Set;
import java.util.UUID;

public interface PremiumFeatureStore {

    /**
     * Buys one feature with spendable XP. The debit and the ownership record commit together.
     *
     * @throws uk.gegc.xpeconomy.features.store.domain.exception.FeatureAlreadyOwnedException if owned; nothing is charged
     * @throws uk.gegc.xpeconomy.features.ledger.domain.exception.InsufficientXpException when the balance is short
     */
    PurchaseResultDto purchaseFeature(UUID accountId, String featureId);

    /**
     * Grants every bundled feature the account does not own yet, for the lower of the bundle price and
     * the sum of those features' prices. All or nothing.
     */
    PurchaseResultDto purchaseBundle(UUID accountId, String bundleId);

    /**
     * @param accountId optional; without it every ownership flag is false
     */
    List<FeatureDto> listCatalog(UUID accountId);

    List<FeatureBundleDto> listBundles();

    Set<String> ownedFeatureIds(UUID accountId);

    FeatureDto updatePrice(String featureId, long price);
}
