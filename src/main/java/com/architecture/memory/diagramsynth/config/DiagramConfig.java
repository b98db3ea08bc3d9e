package com.architecture.memory.diagramsynth.config;

import com.architecture.memory.diagramsynth.model.layout.LayoutConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default layout geometry and diagram limits, read from the {@code diagram.*} properties.
 */
@Configuration
@Slf4j
public class DiagramConfig {

    @Value("${diagram.layout.node-width:180}")
    private double nodeWidth;

    @Value("${diagram.layout.node-height:70}")
    private double nodeHeight;

    @Value("${diagram.layout.node-spacing-x:80}")
    private double nodeSpacingX;

    @Value("${diagram.layout.node-spacing-y:120}")
    private double nodeSpacingY;

    @Value("${diagram.layout.start-x:0}")
    private double startX;

    @Value("${diagram.layout.start-y:0}")
    private double startY;

    @Value("${diagram.layout.padding:40}")
    private double padding;

    @Value("${diagram.layout.participant-width:120}")
    private double participantWidth;

    @Value("${diagram.layout.participant-height:50}")
    private double participantHeight;

    @Value("${diagram.layout.participant-spacing:180}")
    private double participantSpacing;

    @Value("${diagram.layout.message-spacing:60}")
    private double messageSpacing;

    @Value("${diagram.layout.message-gap:30}")
    private double messageGap;

    @Value("${diagram.limits.max-nodes:500}")
    private int maxNodes;

    /**
     * Layout used when a request does not override anything.
     */
    @Bean
    public LayoutConfig defaultLayoutConfig() {
        log.info("[Diagram Config] Default node size {}x{}, spacing {}/{}",
                nodeWidth, nodeHeight, nodeSpacingX, nodeSpacingY);

        return LayoutConfig.builder()
                .nodeWidth(nodeWidth)
                .nodeHeight(nodeHeight)
                .nodeSpacingX(nodeSpacingX)
                .nodeSpacingY(nodeSpacingY)
                .startX(startX)
                .startY(startY)
                .padding(padding)
                .participantWidth(participantWidth)
                .participantHeight(participantHeight)
                .participantSpacing(participantSpacing)
                .messageSpacing(messageSpacing)
                .messageGap(messageGap)
                .build();
    }

    @Bean
    public DiagramLimits diagramLimits() {
        log.info("[Diagram Config] Max nodes per diagram: {}", maxNodes);
        return new DiagramLimits(maxNodes);
    }
}
