package com.timetree.controller;

import com.timetree.model.LayoutResult;
import com.timetree.model.LeafOrder;
import com.timetree.model.TimeTree;
import com.timetree.model.TreeSummary;
import com.timetree.service.ChronogramLayoutEngine;
import com.timetree.service.LayoutRenderClient;
import com.timetree.service.LayoutRenderClient.RendererException;
import com.timetree.service.TimeTreeService;
import com.timetree.service.TreeMutator;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.util.HtmlUtils;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stateless JSON API over the tree library. Every request carries its tree as Newick (or NEXUS)
 * text and gets the edited tree or its layout back.
 */
@RestController
@RequestMapping("/api/timetrees")
public class TimeTreeApiController {

    private static final MediaType SVG_MEDIA_TYPE = MediaType.valueOf("image/svg+xml");

    private final TimeTreeService timeTreeService;
    private final TreeMutator treeMutator;
    private final ChronogramLayoutEngine layoutEngine;
    private final LayoutRenderClient renderClient;

    public TimeTreeApiController(TimeTreeService timeTreeService,
                                 TreeMutator treeMutator,
                                 ChronogramLayoutEngine layoutEngine,
                                 LayoutRenderClient renderClient) {
        this.timeTreeService = timeTreeService;
        this.treeMutator = treeMutator;
        this.layoutEngine = layoutEngine;
        this.renderClient = renderClient;
    }

    public record TreeRequest(String newick, Double rootAge, Boolean leafAligned) {
    }

    public record NodeRequest(String newick, Double rootAge, Boolean leafAligned, String label) {
    }

    public record RescaleRequest(String newick, Double rootAge, Boolean leafAligned, Double factor, Double offset) {
    }

    public record LayoutRequest(String newick, Double rootAge, Boolean leafAligned, LeafOrder leafOrder) {
    }

    @PostMapping("/parse")
    public ResponseEntity<TreeSummary> parse(@RequestBody TreeRequest request) {
        TimeTree tree = timeTreeService.load(request.newick(), request.rootAge(), Boolean.TRUE.equals(request.leafAligned()));
        return ResponseEntity.ok(timeTreeService.summarize(tree));
    }

    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(@RequestBody TreeRequest request) {
        TimeTree tree = timeTreeService.load(request.newick(), request.rootAge(), Boolean.TRUE.equals(request.leafAligned()));
        return ResponseEntity.ok(Map.of("valid", tree.validate()));
    }

    /**
     * Prune the subtree at the labelled node. Returns both the remaining tree and the detached piece.
     */
    @PostMapping("/prune")
    public ResponseEntity<Map<String, Object>> prune(@RequestBody NodeRequest request) {
        TimeTree tree = timeTreeService.load(request.newick(), request.rootAge(), Boolean.TRUE.equals(request.leafAligned()));
        TimeTree pruned = treeMutator.prune(tree, timeTreeService.requireNode(tree, request.label()));

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("remaining", timeTreeService.summarize(tree));
        response.put("pruned", timeTreeService.summarize(pruned));
        return ResponseEntity.ok(response);
    }

    @PostMapping("/reroot")
    public ResponseEntity<TreeSummary> reroot(@RequestBody NodeRequest request) {
        TimeTree tree = timeTreeService.load(request.newick(), request.rootAge(), Boolean.TRUE.equals(request.leafAligned()));
        treeMutator.reroot(tree, timeTreeService.requireNode(tree, request.label()));
        return ResponseEntity.ok(timeTreeService.summarize(tree));
    }

    /**
     * Multiply ages by {@code factor} and/or add {@code offset}; the factor is applied first.
     */
    @PostMapping("/rescale")
    public ResponseEntity<TreeSummary> rescale(@RequestBody RescaleRequest request) {
        if (request.factor() == null && request.offset() == null) {
            throw new IllegalArgumentException("Rescale needs a factor, an offset or both");
        }
        TimeTree tree = timeTreeService.load(request.newick(), request.rootAge(), Boolean.TRUE.equals(request.leafAligned()));
        if (request.factor() != null) {
            treeMutator.rescale(tree, request.factor());
        }
        if (request.offset() != null) {
            treeMutator.shift(tree, request.offset());
        }
        return ResponseEntity.ok(timeTreeService.summarize(tree));
    }

    @PostMapping("/layout")
    public ResponseEntity<LayoutResult> layout(@RequestBody LayoutRequest request) {
        return ResponseEntity.ok(computeLayout(request));
    }

    /**
     * Lay out the tree and pass the layout to the external renderer.
     */
    @PostMapping("/render")
    public ResponseEntity<byte[]> render(@RequestBody LayoutRequest request) {
        LayoutResult layout = computeLayout(request);
        try {
            byte[] image = renderClient.render(layout);
            return ResponseEntity.ok().contentType(SVG_MEDIA_TYPE).body(image);
        } catch (RendererException e) {
            return ResponseEntity.status(502).contentType(SVG_MEDIA_TYPE)
                    .body(errorSvg("Renderer unavailable"));
        }
    }

    private LayoutResult computeLayout(LayoutRequest request) {
        TimeTree tree = timeTreeService.load(request.newick(), request.rootAge(), Boolean.TRUE.equals(request.leafAligned()));
        return request.leafOrder() != null
                ? layoutEngine.layout(tree, request.leafOrder())
                : layoutEngine.layout(tree);
    }

    /**
     * Placeholder image shown in place of the chronogram when the renderer cannot be reached.
     */
    private byte[] errorSvg(String message) {
        StringBuilder svg = new StringBuilder()
                .append("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"320\" height=\"48\">")
                .append("<line x1=\"16\" y1=\"24\" x2=\"64\" y2=\"24\" stroke=\"#9ca3af\" stroke-dasharray=\"4 4\"/>")
                .append("<text x=\"76\" y=\"29\" font-family=\"sans-serif\" font-size=\"13\" fill=\"#b91c1c\">")
                .append(HtmlUtils.htmlEscape(message))
                .append("</text></svg>");
        return svg.toString().getBytes(StandardCharsets.UTF_8);
    }
}
