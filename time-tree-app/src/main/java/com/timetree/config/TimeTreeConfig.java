package com.timetree.config;

import com.timetree.model.LeafOrder;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Parser, layout and renderer settings.
 * Defined in application.yml under 'timetree'.
 */
@Configuration
@ConfigurationProperties(prefix = "timetree")
public class TimeTreeConfig {

    // Used for a child written without ':length'
    private double defaultBranchLength = 1.0;

    private double ultrametricTolerance = 1e-9;

    private Layout layout = new Layout();

    private Renderer renderer = new Renderer();

    public double getDefaultBranchLength() { return defaultBranchLength; }
    public void setDefaultBranchLength(double defaultBranchLength) { this.defaultBranchLength = defaultBranchLength; }

    public double getUltrametricTolerance() { return ultrametricTolerance; }
    public void setUltrametricTolerance(double ultrametricTolerance) { this.ultrametricTolerance = ultrametricTolerance; }

    public Layout getLayout() { return layout; }
    public void setLayout(Layout layout) { this.layout = layout; }

    public Renderer getRenderer() { return renderer; }
    public void setRenderer(Renderer renderer) { this.renderer = renderer; }

    public static class Layout {
        private LeafOrder leafOrder = LeafOrder.INPUT;

        public LeafOrder getLeafOrder() { return leafOrder; }
        public void setLeafOrder(LeafOrder leafOrder) { this.leafOrder = leafOrder; }
    }

    /**
     * External service that turns a layout into an image.
     */
    public static class Renderer {
        private String url = "http://localhost:3300";
        private String path = "/render";

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }
}
