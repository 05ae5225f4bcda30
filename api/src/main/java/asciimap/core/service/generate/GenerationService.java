package asciimap.core.service.generate;

import java.nio.charset.StandardCharsets;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;

import asciimap.core.model.generate.GenerateConfig;
import asciimap.core.model.generate.GenerateMeta;
import asciimap.core.model.generate.GenerateOutcome;
import asciimap.core.model.generate.GenerateResult;
import asciimap.core.model.generate.RenderVariant;
import asciimap.core.model.render.LandMask;
import asciimap.core.model.render.RenderException;
import asciimap.core.model.render.RenderOptions;
import asciimap.core.port.in.GenerateUseCase;
import asciimap.core.port.out.RenderingEngine;

/**
 * Orchestrates the renderer invocations for a generate request.
 *
 * <p>The plain variant is always rendered with colour mode forced to never. When colour mode is
 * always, a second independent invocation renders the colourised variant from the same geometry;
 * if it fails the whole request fails. When colour mode is never, the plain text doubles as the
 * ansi output and the renderer is called once.
 *
 * <p>Rendering is blocking, so it is moved off the caller's thread onto the worker pool.
 */
@ApplicationScoped
public class GenerationService implements GenerateUseCase {

    private static final Logger LOG = Logger.getLogger(GenerationService.class);

    private final LandMask mask;
    private final RenderingEngine renderingEngine;

    @Inject
    public GenerationService(LandMask mask, RenderingEngine renderingEngine) {
        this.mask = mask;
        this.renderingEngine = renderingEngine;
    }

    @Override
    public Uni<GenerateOutcome> generate(GenerateConfig config) {
        return Uni.createFrom().item(() -> render(config)).runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    GenerateOutcome render(GenerateConfig config) {
        final long startTime = System.nanoTime();

        final String plain;
        try {
            plain = renderingEngine.render(
                    mask,
                    config.width(),
                    config.supersample(),
                    config.charAspect(),
                    config.marker(),
                    RenderOptions.plain(config.margin(), config.frame()));
        } catch (RenderException e) {
            return renderFailed(RenderVariant.PLAIN, e);
        }

        var ansi = plain;
        if (config.color().colorized()) {
            try {
                ansi = renderingEngine.render(
                        mask,
                        config.width(),
                        config.supersample(),
                        config.charAspect(),
                        config.marker(),
                        RenderOptions.colored(config.margin(), config.frame(), config.color()));
            } catch (RenderException e) {
                return renderFailed(RenderVariant.COLORIZED, e);
            }
        }

        final long durationMs = (System.nanoTime() - startTime) / 1_000_000;
        final var meta = new GenerateMeta(
                config.width(),
                GenerateMeta.deriveHeight(config.width(), config.charAspect()),
                config.supersample(),
                config.charAspect(),
                durationMs,
                plain.getBytes(StandardCharsets.UTF_8).length);

        LOG.debugv(
                "Generated map width={0} height={1} colorized={2} in {3}ms",
                meta.width(),
                meta.height(),
                config.color().colorized(),
                durationMs);
        return new GenerateOutcome.Generated(new GenerateResult(plain, ansi, meta));
    }

    private static GenerateOutcome renderFailed(RenderVariant variant, RenderException e) {
        LOG.warnv("Render of {0} variant failed: {1}", variant.label(), e.getMessage());
        return new GenerateOutcome.RenderFailed(variant, e.getMessage());
    }
}
