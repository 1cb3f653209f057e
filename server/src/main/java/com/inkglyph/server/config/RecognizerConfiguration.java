package com.inkglyph.server.config;

import com.inkglyph.server.ai.GlyphRecognizer;
import com.inkglyph.server.ai.InkCapture;
import com.inkglyph.server.ai.encode.TensorEncoder;
import com.inkglyph.server.ai.geometry.BoundsCalculator;
import com.inkglyph.server.ai.geometry.FitTransform;
import com.inkglyph.server.ai.labels.LabelFilter;
import com.inkglyph.server.ai.labels.UnicodeRangePolicy;
import com.inkglyph.server.ai.ranking.MinMaxScorePolicy;
import com.inkglyph.server.ai.ranking.ResultRanker;
import com.inkglyph.server.ai.render.RoundPenRenderPolicy;
import com.inkglyph.server.ai.render.StrokeRasterizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Composition root: the capture pipeline and the recognizer are built here once
 * and injected wherever they are needed.
 */
@Configuration
public class RecognizerConfiguration {

    @Bean
    public RecognizerConfig.ConfigRoot recognizerConfigRoot() {
        return RecognizerConfig.load();
    }

    @Bean
    public RecognizerSettings recognizerSettings(RecognizerConfig.ConfigRoot root) {
        return RecognizerSettings.from(root);
    }

    @Bean
    public InkCapture inkCapture(RecognizerSettings settings) {
        return buildCapture(settings);
    }

    @Bean(destroyMethod = "close")
    public GlyphRecognizer glyphRecognizer(RecognizerSettings settings) {
        return buildRecognizer(settings);
    }

    public static InkCapture buildCapture(RecognizerSettings settings) {
        return new InkCapture(
                new BoundsCalculator(settings.padding, settings.canvasSize),
                new FitTransform(settings.canvasSize, settings.minSize, settings.maxSize),
                new StrokeRasterizer(settings.canvasSize, new RoundPenRenderPolicy((float) settings.strokeWidth)));
    }

    public static GlyphRecognizer buildRecognizer(RecognizerSettings settings) {
        return new GlyphRecognizer(
                new TensorEncoder(settings.modelInputSize),
                new LabelFilter(new UnicodeRangePolicy(settings.rangeStart, settings.rangeEnd)),
                new ResultRanker(new MinMaxScorePolicy(), settings.topK));
    }
}
