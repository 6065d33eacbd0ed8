package com.otcswap.domain.swap;

import java.util.Collection;
import java.util.List;

public final class AssetAllowlist {
  private final EnumerableSet<String> assets;

  public AssetAllowlist(Collection<String> initialAssets, ChangeJournal journal) {
    if (initialAssets == null || initialAssets.isEmpty()) {
      throw new SwapValidationException("Must allow at least one token");
    }
    this.assets = new EnumerableSet<>(journal);
    for (String asset : initialAssets) {
      requireValidAsset(asset);
      assets.seed(asset);
    }
  }

  public boolean isAllowed(String asset) {
    return asset != null && assets.contains(asset);
  }

  public List<String> list() {
    return assets.values();
  }

  public int size() {
    return assets.size();
  }

  public boolean add(String asset) {
    requireValidAsset(asset);
    return assets.add(asset);
  }

  public boolean remove(String asset) {
    requireValidAsset(asset);
    return assets.remove(asset);
  }

  public static void requireValidAsset(String asset) {
    if (asset == null || asset.isBlank()) {
      throw new SwapValidationException("Invalid token address");
    }
  }
}
