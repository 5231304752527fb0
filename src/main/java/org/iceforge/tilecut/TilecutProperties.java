package org.iceforge.tilecut;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Service-wide settings for the cutout pipeline.
 * <p>
 * Defaults point at directories under the working directory so a local run needs no
 * extra configuration beyond {@code archiveRoot}.
 */
@Validated
@ConfigurationProperties(prefix = "tilecut")
public class TilecutProperties {

    /** Root of the tile archive: {@code <archiveRoot>/<tileId>/<instrument>/<file>.fits}. */
    @NotBlank
    private String archiveRoot = "./data/tiles";

    /** JSON tile index. Built from {@link #tileCatalogRoot} when missing. */
    @NotBlank
    private String tileIndexFile = "./data/tile-index.json";

    /** Where the per-tile source catalogs live; usually the archive root itself. */
    private String tileCatalogRoot;

    /** Substring identifying a tile's source catalog inside its directory. */
    @NotBlank
    private String tileCatalogPattern = "EUC_MER_FINAL-CAT_TILE";

    /** How far (degrees) a position may sit outside a tile's box and still match it. */
    @DecimalMin("0.0")
    private double tileToleranceDeg = 0.01;

    /** Root of the artifact cache (ephemeral per-run tier and permanent tier). */
    @NotBlank
    private String cacheDir = "./data/cache";

    /** Scratch space for in-flight tasks. */
    @NotBlank
    private String workDir = "./data/work";

    /** Catalogs uploaded through the API, one directory per upload id. */
    @NotBlank
    private String uploadDir = "./data/uploads";

    /** Where finished task archives are kept. */
    @NotBlank
    private String outputDir = "./data/output";

    /** Catalog rows beyond this count are dropped, with a notice. */
    @Min(1)
    private int maxCatalogRows = 10_000;

    /** Default tile-group workers per task. */
    @Min(1)
    @Max(16)
    private int workers = 4;

    /** How many tasks may run at the same time. */
    @Min(1)
    private int maxConcurrentTasks = 2;

    /** Publish progress every N completed requests. */
    @Min(1)
    private int progressEvery = 10;

    /** Failure samples kept per task. */
    @Min(0)
    private int maxFailureSamples = 10;

    public String getArchiveRoot() {
        return archiveRoot;
    }

    public void setArchiveRoot(String archiveRoot) {
        this.archiveRoot = archiveRoot;
    }

    public String getTileIndexFile() {
        return tileIndexFile;
    }

    public void setTileIndexFile(String tileIndexFile) {
        this.tileIndexFile = tileIndexFile;
    }

    public String getTileCatalogRoot() {
        return tileCatalogRoot;
    }

    public void setTileCatalogRoot(String tileCatalogRoot) {
        this.tileCatalogRoot = tileCatalogRoot;
    }

    public String getTileCatalogPattern() {
        return tileCatalogPattern;
    }

    public void setTileCatalogPattern(String tileCatalogPattern) {
        this.tileCatalogPattern = tileCatalogPattern;
    }

    public double getTileToleranceDeg() {
        return tileToleranceDeg;
    }

    public void setTileToleranceDeg(double tileToleranceDeg) {
        this.tileToleranceDeg = tileToleranceDeg;
    }

    public String getCacheDir() {
        return cacheDir;
    }

    public void setCacheDir(String cacheDir) {
        this.cacheDir = cacheDir;
    }

    public String getUploadDir() {
        return uploadDir;
    }

    public void setUploadDir(String uploadDir) {
        this.uploadDir = uploadDir;
    }

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public int getMaxCatalogRows() {
        return maxCatalogRows;
    }

    public void setMaxCatalogRows(int maxCatalogRows) {
        this.maxCatalogRows = maxCatalogRows;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int getMaxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public void setMaxConcurrentTasks(int maxConcurrentTasks) {
        this.maxConcurrentTasks = maxConcurrentTasks;
    }

    public int getProgressEvery() {
        return progressEvery;
    }

    public void setProgressEvery(int progressEvery) {
        this.progressEvery = progressEvery;
    }

    public int getMaxFailureSamples() {
        return maxFailureSamples;
    }

    public void setMaxFailureSamples(int maxFailureSamples) {
        this.maxFailureSamples = maxFailureSamples;
    }
}
