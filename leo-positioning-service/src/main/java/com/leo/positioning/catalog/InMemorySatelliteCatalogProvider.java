package com.leo.positioning.catalog;

import com.leo.positioning.dto.SatelliteDescriptor;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import lombok.extern.slf4j.Slf4j;

/**
 * Catalog held in memory and replaceable at runtime. A replacement swaps one reference, so a
 * reader either sees the old catalog and label or the new ones, never a mix.
 */
@Slf4j
public class InMemorySatelliteCatalogProvider implements SatelliteCatalogProvider {

  private final AtomicReference<Catalog> current;

  public InMemorySatelliteCatalogProvider(List<SatelliteDescriptor> satellites, String source) {
    this.current = new AtomicReference<>(new Catalog(satellites, source));
  }

  @Override
  public List<SatelliteDescriptor> snapshot() {
    return current.get().satellites();
  }

  @Override
  public String getSourceLabel() {
    return current.get().source();
  }

  /**
   * Replaces the whole catalog.
   *
   * @param satellites new entries
   * @param source label for the new entries
   */
  public void replace(List<SatelliteDescriptor> satellites, String source) {
    Catalog next = new Catalog(satellites, source);
    Catalog previous = current.getAndSet(next);
    log.info("Satellite catalog replaced: {} -> {} entries, source {}",
        previous.satellites().size(), next.satellites().size(), next.source());
  }

  public int size() {
    return current.get().satellites().size();
  }

  private record Catalog(List<SatelliteDescriptor> satellites, String source) {
    private Catalog {
      Objects.requireNonNull(source, "source");
      satellites = List.copyOf(satellites);
    }
  }
}
