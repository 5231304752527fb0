package org.iceforge.tilecut.api;

import org.iceforge.tilecut.sky.SpatialTileIndex;
import org.iceforge.tilecut.sky.TileRecord;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

@RestController
@RequestMapping("/api/tiles")
public class TileController {

    private final SpatialTileIndex tileIndex;

    public TileController(SpatialTileIndex tileIndex) {
        this.tileIndex = Objects.requireNonNull(tileIndex);
    }

    @GetMapping("/lookup")
    public ResponseEntity<Map<String, Object>> lookup(@RequestParam double ra,
                                                      @RequestParam double dec,
                                                      @RequestParam(required = false) Double tolerance) {
        double tol = tolerance != null ? tolerance : tileIndex.defaultTolerance();
        if (!(tol >= 0.0)) {
            throw new IllegalArgumentException("tolerance must be >= 0");
        }
        TileRecord tile = tileIndex.lookup(ra, dec, tol).flatMap(tileIndex::get).orElse(null);
        if (tile == null) return ResponseEntity.notFound().build();

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tileId", tile.tileId());
        out.put("separationDeg", tile.separationFromCenter(ra, dec));
        out.put("tile", tile);
        return ResponseEntity.ok(out);
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("tiles", tileIndex.size());
        out.put("defaultToleranceDeg", tileIndex.defaultTolerance());
        return out;
    }
}
