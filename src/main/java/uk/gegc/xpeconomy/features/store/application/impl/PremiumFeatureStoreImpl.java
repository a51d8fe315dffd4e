package uk.gegc.xpeconomy.features.store.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.xpeconomy.features.account.domain.model.Account;
import uk.gegc.xpeconomy.features.account.infra.repository.AccountRepository;
import uk.gegc.xpeconomy.features.ledger.application.LedgerService;
import uk.gegc.xpeconomy.features.ledger.application.TransactionRefs;
import uk.gegc.xpeconomy.features.ledger.application.XpMutationExecutor;
import uk.gegc.xpeconomy.features.ledger.domain.model.XpTransactionSource;
import uk.gegc.xpeconomy.features.store.api.dto.FeatureBundleDto;
import uk.gegc.xpeconomy.features.store.api.dto.FeatureDto;
import uk.gegc.xpeconomy.features.store.api.dto.PurchaseResultDto;
import uk.gegc.xpeconomy.features.store.application.PremiumFeatureStore;
import uk.gegc.xpeconomy.features.store.domain.exception.FeatureAlreadyOwnedException;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureBundle;
import uk.gegc.xpeconomy.features.store.domain.model.FeatureCatalogEntry;
import uk.gegc.xpeconomy.features.store.domain.model.FeaturePurchase;
import uk.gegc.xpeconomy.features.store.infra.mapping.StoreMapper;
import uk.gegc.xpeconomy.features.store.infra.repository.FeatureBundleRepository;
import uk.gegc.xpeconomy.features.store.infra.repository.FeatureCatalogRepository;
import uk.gegc.xpeconomy.features.store.infra.repository.FeaturePurchaseRepository;
import uk.gegc.xpeconomy.shared.exception.ResourceNotFoundException;
import uk.gegc.xpeconomy.shared.exception.XpValidationException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class PremiumFeatureStoreImpl implements PremiumFeatureStore {

    private final AccountRepository accountRepository;
    private final FeatureCatalogRepository catalogRepository;
    private final FeatureBundleRepository bundleRepository;
    private final FeaturePurchaseRepository purchaseRepository;
    private final LedgerService ledgerService;
    private final XpMutationExecutor mutationExecutor;
    private final StoreMapper storeMapper;
    private final Clock clock;

    @Override
    public PurchaseResultDto purchaseFeature(UUID accountId, String featureId) {
        FeatureCatalogEntry feature = catalogRepository.findById(featureId)
                .filter(FeatureCatalogEntry::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Feature " + featureId + " not found"));

        return mutationExecutor.execute(accountId, "feature-purchase", () -> {
            Account account = lockAccount(accountId);
            if (purchaseRepository.existsByAccountIdAndFeatureId(accountId, featureId)) {
                throw FeatureAlreadyOwnedException.feature(featureId);
            }

            UUID transactionId = ledgerService.spend(
                    accountId,
                    feature.getPrice(),
                    XpTransactionSource.FEATURE_PURCHASE,
                    "Purchased " + feature.getDisplayName(),
                    TransactionRefs.none().withFeature(featureId)
            ).id();

            FeaturePurchase purchase = newPurchase(accountId, featureId, feature.getPrice(), transactionId, null);
            purchase = purchaseRepository.save(purchase);
            log.info("Account {} bought feature {} for {} XP", accountId, featureId, feature.getPrice());

            return new PurchaseResultDto(accountId, List.of(storeMapper.toDto(purchase)), feature.getPrice(),
                    transactionId, account.getSpendableXp());
        });
    }

    @Override
    public PurchaseResultDto purchaseBundle(UUID accountId, String bundleId) {
        FeatureBundle bundle = bundleRepository.findById(bundleId)
                .filter(FeatureBundle::isActive)
                .orElseThrow(() -> new ResourceNotFoundException("Bundle " + bundleId + " not found"));
        List<FeatureCatalogEntry> features = catalogRepository.findAllById(bundle.getFeatureIds());
        if (features.size() != bundle.getFeatureIds().size()) {
            throw new ResourceNotFoundException("Bundle " + bundleId + " references a feature that does not exist");
        }

        return mutationExecutor.execute(accountId, "bundle-purchase", () -> {
            Account account = lockAccount(accountId);
            Set<String> owned = purchaseRepository.findFeatureIdsByAccountId(accountId);

            List<FeatureCatalogEntry> toGrant = features.stream()
                    .filter(f -> !owned.contains(f.getId()))
                    .toList();
            if (toGrant.isEmpty()) {
                throw FeatureAlreadyOwnedException.bundle(bundleId);
            }

            long unownedValue = toGrant.stream().mapToLong(FeatureCatalogEntry::getPrice).sum();
            long price = Math.min(bundle.getPrice(), unownedValue);

            UUID transactionId = ledgerService.spend(
                    accountId,
                    price,
                    XpTransactionSource.BUNDLE_PURCHASE,
                    "Purchased bundle " + bundle.getDisplayName(),
                    TransactionRefs.none().withFeature(bundleId)
            ).id();

            List<FeaturePurchase> purchases = new ArrayList<>();
            long remaining = price;
            for (int i = 0; i < toGrant.size(); i++) {
                FeatureCatalogEntry feature = toGrant.get(i);
                // the last grant absorbs the rounding so the shares add up to the charge
                long share = i == toGrant.size() - 1
                        ? remaining
                        : price * feature.getPrice() / unownedValue;
                remaining -= share;
                purchases.add(newPurchase(accountId, feature.getId(), share, transactionId, bundleId));
            }
            purchases = purchaseRepository.saveAll(purchases);
            log.info("Account {} bought bundle {} for {} XP, granting {}", accountId, bundleId, price,
                    toGrant.stream().map(FeatureCatalogEntry::getId).toList());

            return new PurchaseResultDto(accountId, storeMapper.toPurchaseDtos(purchases), price, transactionId,
                    account.getSpendableXp());
        });
    }

    @Override
    @Transactional(readOnly = true)
    public List<FeatureDto> listCatalog(UUID accountId) {
        Set<String> owned;
        long spendable;
        if (accountId != null) {
            Account account = accountRepository.findById(accountId)
                    .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
            owned = purchaseRepository.findFeatureIdsByAccountId(accountId);
            spendable = account.getSpendableXp();
        } else {
            owned = Set.of();
            spendable = 0L;
        }
        return catalogRepository.findByActiveTrueOrderByCategoryAscPriceAsc().stream()
                .map(entry -> toDto(entry, owned, accountId != null && spendable >= entry.getPrice()))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<FeatureBundleDto> listBundles() {
        return storeMapper.toBundleDtos(bundleRepository.findByActiveTrueOrderByPriceAsc());
    }

    @Override
    @Transactional(readOnly = true)
    public Set<String> ownedFeatureIds(UUID accountId) {
        if (!accountRepository.existsById(accountId)) {
            throw new ResourceNotFoundException("Account " + accountId + " not found");
        }
        return purchaseRepository.findFeatureIdsByAccountId(accountId);
    }

    @Override
    @Transactional
    public FeatureDto updatePrice(String featureId, long price) {
        if (price <= 0) {
            throw new XpValidationException("price must be > 0");
        }
        FeatureCatalogEntry entry = catalogRepository.findById(featureId)
                .orElseThrow(() -> new ResourceNotFoundException("Feature " + featureId + " not found"));
        long previous = entry.getPrice();
        entry.setPrice(price);
        entry.setUpdatedAt(LocalDateTime.now(clock));
        entry = catalogRepository.save(entry);
        log.info("Price of feature {} changed from {} to {} XP", featureId, previous, price);
        return toDto(entry, Set.of(), false);
    }

    private FeatureDto toDto(FeatureCatalogEntry entry, Set<String> owned, boolean affordable) {
        return new FeatureDto(
                entry.getId(),
                entry.getDisplayName(),
                entry.getDescription(),
                entry.getPrice(),
                entry.getCategory(),
                Set.copyOf(entry.getPrerequisites()),
                owned.contains(entry.getId()),
                affordable,
                owned.containsAll(entry.getPrerequisites())
        );
    }

    private FeaturePurchase newPurchase(UUID accountId, String featureId, long cost, UUID transactionId,
                                        String bundleId) {
        FeaturePurchase purchase = new FeaturePurchase();
        purchase.setAccountId(accountId);
        purchase.setFeatureId(featureId);
        purchase.setCostPaid(cost);
        purchase.setTransactionId(transactionId);
        purchase.setBundleId(bundleId);
        purchase.setPurchasedAt(LocalDateTime.now(clock));
        return purchase;
    }

    private Account lockAccount(UUID accountId) {
        return accountRepository.findByIdForUpdate(accountId)
                .orElseThrow(() -> new ResourceNotFoundException("Account " + accountId + " not found"));
    }
}
