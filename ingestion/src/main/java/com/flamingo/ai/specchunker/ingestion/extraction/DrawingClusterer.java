package com.flamingo.ai.specchunker.ingestion.extraction;

import com.flamingo.ai.specchunker.config.IngestionConfig;
import com.flamingo.ai.specchunker.ingestion.model.BoundingBox;
import com.flamingo.ai.specchunker.ingestion.model.DrawingRegion;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Groups individual vector drawing elements into regions.
 *
 * <p>Two elements belong to the same region when their boxes overlap or lie within the configured
 * padding of each other (single-linkage). Merging repeats on the grown cluster boxes until no two
 * clusters touch, so a cluster never overlaps another one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DrawingClusterer {

  private final IngestionConfig config;

  public List<DrawingRegion> cluster(List<BoundingBox> elements) {
    if (elements.isEmpty()) {
      return List.of();
    }
    float padding = config.getExtraction().getDrawingClusterPadding();

    List<BoundingBox> boxes = new ArrayList<>(elements);
    List<Integer> counts = new ArrayList<>();
    elements.forEach(e -> counts.add(1));

    boolean merged = true;
    while (merged) {
      int n = boxes.size();
      UnionFind uf = new UnionFind(n);
      for (int i = 0; i < n; i++) {
        for (int j = i + 1; j < n; j++) {
          if (boxes.get(i).isNear(boxes.get(j), padding)) {
            uf.union(i, j);
          }
        }
      }
      List<List<Integer>> groups = uf.groups();
      merged = groups.size() < n;

      List<BoundingBox> nextBoxes = new ArrayList<>(groups.size());
      List<Integer> nextCounts = new ArrayList<>(groups.size());
      for (List<Integer> group : groups) {
        BoundingBox bbox = boxes.get(group.get(0));
        int count = 0;
        for (int index : group) {
          bbox = bbox.union(boxes.get(index));
          count += counts.get(index);
        }
        nextBoxes.add(bbox);
        nextCounts.add(count);
      }
      boxes = nextBoxes;
      counts.clear();
      counts.addAll(nextCounts);
    }

    List<DrawingRegion> regions = new ArrayList<>(boxes.size());
    for (int i = 0; i < boxes.size(); i++) {
      regions.add(new DrawingRegion(boxes.get(i), counts.get(i)));
    }
    regions.sort(
        Comparator.comparingDouble((DrawingRegion r) -> r.bbox().y0())
            .thenComparingDouble(r -> r.bbox().x0()));
    log.trace("Clustered {} drawing elements into {} regions", elements.size(), regions.size());
    return regions;
  }
}
