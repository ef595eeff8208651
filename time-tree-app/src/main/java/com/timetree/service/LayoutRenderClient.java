package com.timetree.service;

import com.timetree.config.TimeTreeConfig;
import com.timetree.model.LayoutResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Hands computed layouts to the external rendering service, which answers with an image.
 */
@Service
public class LayoutRenderClient {

    private static final Logger log = LoggerFactory.getLogger(LayoutRenderClient.class);

    private final RestClient restClient;
    private final String renderUrl;

    public LayoutRenderClient(RestClient.Builder restClientBuilder, TimeTreeConfig config) {
        this.restClient = restClientBuilder.build();
        this.renderUrl = config.getRenderer().getUrl() + config.getRenderer().getPath();
    }

    /**
     * Render a layout using the external renderer.
     *
     * @param layout node positions and edge paths to draw
     * @return image content as returned by the renderer (SVG by default)
     * @throws RendererException if the renderer is unavailable or returns an error
     */
    public byte[] render(LayoutResult layout) {
        try {
            return restClient.post()
                    .uri(renderUrl)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(layout)
                    .retrieve()
                    .body(byte[].class);
        } catch (RestClientException e) {
            log.warn("Renderer at {} failed: {}", renderUrl, e.getMessage());
            throw new RendererException("Failed to render layout: " + e.getMessage(), e);
        }
    }

    public static class RendererException extends RuntimeException {
        public RendererException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
