package com.visualoom.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.nio.file.Paths;

@Configuration
@ConfigurationProperties(prefix = "app")
public class AppConfig {

    /** Base data directory */
    private String dataDir = "./data";

    /** JSON file holding the image catalog */
    private String catalogFile = "./data/image_data.json";

    /** JSON file holding the tag catalog */
    private String tagFile = "./data/tags.json";

    /** Number of semantic matches requested when the caller does not say */
    private int defaultTopK = 10;

    /** Maximum top-K accepted from API callers */
    private int searchLimit = 100;

    /** New records buffered by a sweep before they are written to the catalog */
    private int indexFlushSize = 50;

    // ───────────── getters / setters ─────────────

    public String getDataDir() {
        return dataDir;
    }

    public void setDataDir(String dataDir) {
        this.dataDir = dataDir;
    }

    public String getCatalogFile() {
        return catalogFile;
    }

    public void setCatalogFile(String catalogFile) {
        this.catalogFile = catalogFile;
    }

    public Path getCatalogPath() {
        return Paths.get(catalogFile).toAbsolutePath().normalize();
    }

    public String getTagFile() {
        return tagFile;
    }

    public void setTagFile(String tagFile) {
        this.tagFile = tagFile;
    }

    public Path getTagPath() {
        return Paths.get(tagFile).toAbsolutePath().normalize();
    }

    public int getDefaultTopK() {
        return defaultTopK;
    }

    public void setDefaultTopK(int defaultTopK) {
        this.defaultTopK = defaultTopK;
    }

    public int getSearchLimit() {
        return searchLimit;
    }

    public void setSearchLimit(int searchLimit) {
        this.searchLimit = searchLimit;
    }

    public int getIndexFlushSize() {
        return indexFlushSize;
    }

    public void setIndexFlushSize(int indexFlushSize) {
        this.indexFlushSize = indexFlushSize;
    }
}
