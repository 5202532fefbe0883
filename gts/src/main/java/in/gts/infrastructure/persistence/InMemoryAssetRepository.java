package in.gts.infrastructure.persistence;

import in.gts.application.port.output.AssetRepository;
import in.gts.domain.model.Asset;
import in.gts.domain.model.Principal;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory asset table. Lifetime = process lifetime.
 */
public final class InMemoryAssetRepository implements AssetRepository {

    private final Map<Long, Asset> assets = new ConcurrentHashMap<>();
    private final AtomicLong lastId = new AtomicLong(0);

    @Override
    public long nextId() {
        return lastId.incrementAndGet();
    }

    @Override
    public Optional<Asset> findById(long assetId) {
        return Optional.ofNullable(assets.get(assetId));
    }

    @Override
    public void insert(Asset asset) {
        Asset previous = assets.putIfAbsent(asset.assetId(), asset);
        if (previous != null) {
            throw new IllegalStateException("Asset id already in use: " + asset.assetId());
        }
    }

    @Override
    public Asset updateOwner(long assetId, Principal newOwner) {
        Asset updated = assets.computeIfPresent(assetId, (id, current) -> current.withOwner(newOwner));
        if (updated == null) {
            throw new IllegalStateException("No asset to update: " + assetId);
        }
        return updated;
    }

    @Override
    public Optional<Asset> delete(long assetId) {
        return Optional.ofNullable(assets.remove(assetId));
    }
}
