package uk.gegc.xpeconomy.features.store.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.xpeconomy.features.store.api.dto.FeatureBundleDto;
import uk.gegc.xpeconomy.features.store.api.dto.FeatureDto;
import uk.gegc.xpeconomy.features.store.api.dto.PurchaseResultDto;
import uk.gegc.xpeconomy.features.store.api.dto.UpdateFeaturePriceRequest;
import uk.gegc.xpeconomy.features.store.application.PremiumFeatureStore;

import java.util.List;
import java.util.Set;
import java.util.UUID;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Validated
@Tag(name = "Feature Store", description = "Premium reading features bought with spendable XP")
public class StoreController {

    private final PremiumFeatureStore featureStore;

    @Operation(summary = "List the feature catalog")
    @GetMapping("/features")
    public ResponseEntity<List<FeatureDto>> listCatalog(
            @Parameter(description = "Adds owned/affordable flags for this account")
            @RequestParam(required = false) UUID accountId) {
        return ResponseEntity.ok(featureStore.listCatalog(accountId));
    }

    @Operation(summary = "List bundles")
    @GetMapping("/features/bundles")
    public ResponseEntity<List<FeatureBundleDto>> listBundles() {
        return ResponseEntity.ok(featureStore.listBundles());
    }

    @Operation(summary = "Owned feature ids")
    @GetMapping("/accounts/{accountId}/features")
    public ResponseEntity<Set<String>> ownedFeatures(@PathVariable UUID accountId) {
        return ResponseEntity.ok(featureStore.ownedFeatureIds(accountId));
    }

    @Operation(summary = "Buy a feature")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Feature bought",
                    content = @Content(schema = @Schema(implementation = PurchaseResultDto.class))),
            @ApiResponse(responseCode = "404", description = "Unknown account or feature",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Already owned or insufficient XP",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/accounts/{accountId}/features/{featureId}/purchase")
    public ResponseEntity<PurchaseResultDto> purchaseFeature(@PathVariable UUID accountId,
                                                             @PathVariable String featureId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(featureStore.purchaseFeature(accountId, featureId));
    }

    @Operation(summary = "Buy a bundle", description = "Grants the bundled features not owned yet")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Bundle bought",
                    content = @Content(schema = @Schema(implementation = PurchaseResultDto.class))),
            @ApiResponse(responseCode = "409", description = "Everything owned or insufficient XP",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping("/accounts/{accountId}/bundles/{bundleId}/purchase")
    public ResponseEntity<PurchaseResultDto> purchaseBundle(@PathVariable UUID accountId,
                                                            @PathVariable String bundleId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(featureStore.purchaseBundle(accountId, bundleId));
    }

    @Operation(summary = "Change a feature price", description = "Existing purchases keep what they paid")
    @PutMapping("/admin/features/{featureId}/price")
    public ResponseEntity<FeatureDto> updatePrice(@PathVariable String featureId,
                                                  @Valid @RequestBody UpdateFeaturePriceRequest request) {
        return ResponseEntity.ok(featureStore.updatePrice(featureId, request.price()));
    }
}
