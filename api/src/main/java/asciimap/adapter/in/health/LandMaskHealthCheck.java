package asciimap.adapter.in.health;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import asciimap.core.model.render.LandMask;
import asciimap.core.port.out.LandMaskLoader;

/**
 * Readiness check for the land mask backing the renderer.
 *
 * <p>Reports the mask source and dimensions. A mask that fails to load aborts startup, so a
 * running service always reports UP; an empty mask is reported DOWN.
 */
@Readiness
@ApplicationScoped
public class LandMaskHealthCheck implements HealthCheck {

    static final String NAME = "land-mask";

    private final LandMask landMask;
    private final LandMaskLoader loader;

    @Inject
    public LandMaskHealthCheck(LandMask landMask, LandMaskLoader loader) {
        this.landMask = landMask;
        this.loader = loader;
    }

    @Override
    public HealthCheckResponse call() {
        HealthCheckResponseBuilder builder = HealthCheckResponse.builder().name(NAME);
        builder.withData("source", loader.source());
        builder.withData("columns", landMask.columns());
        builder.withData("rows", landMask.rows());
        builder.withData("land.cells", landMask.landCells());

        return builder.status(landMask.landCells() > 0).build();
    }
}
