package io.dynamis.bsdf.core;

import io.dynamis.bsdf.api.AllZeroDataException;
import io.dynamis.bsdf.api.AngularGrid;
import io.dynamis.bsdf.api.Branch;
import io.dynamis.bsdf.api.BsdfBuildException;
import io.dynamis.bsdf.api.BsdfVolume;
import io.dynamis.bsdf.api.MeasurementPoint;
import io.dynamis.bsdf.api.PolarMap;
import io.dynamis.bsdf.api.SampleSet;
import io.dynamis.bsdf.api.ShapeMismatchException;
import io.dynamis.bsdf.simulation.AngularProfileFitter;
import io.dynamis.bsdf.simulation.HemisphericalIntegrator;
import io.dynamis.bsdf.simulation.PolarReconstructor;
import io.dynamis.bsdf.simulation.ProfileFit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Builds a BsdfVolume from in-plane measurements.
 *
 * STAGES (see BuildStage):
 *   UNINITIALIZED          measurements, wavelengths and config captured
 *   INCIDENCES_RESOLVED    IncidenceSet taken from config, or from the distinct measured
 *                          incidences in first-occurrence order
 *   PER_CELL_RECONSTRUCTED every (incidence, wavelength) cell fitted, reconstructed and
 *                          integrated, incidence-major / wavelength-minor
 *   RESHAPED               flat results -> [incidence][wavelength][phi][theta];
 *                          btdf additionally reversed along the incidence axis
 *   VALIDATED              all-zero and shape checks passed
 *   READY                  volume exposed
 *
 * FAILURE POLICY: any BsdfBuildException aborts the build and moves the builder to FAILED.
 * No partial volume is ever exposed and nothing is retried.
 *
 * SINGLE USE: one builder performs one build. Repeated build() calls after READY return the
 * same volume; after FAILED they throw IllegalStateException.
 *
 * THREADING: with parallelism > 1 the cells are reconstructed on a fixed pool created for the
 * build. Each task writes only its pre-assigned slot, so no locking is needed. The builder
 * itself is not thread-safe.
 */
public final class BsdfVolumeBuilder {

    private static final Logger log = LoggerFactory.getLogger(BsdfVolumeBuilder.class);

    private final List<MeasurementPoint> measurements;
    private final SampleSet wavelengths;
    private final BsdfBuildConfig config;

    private BuildStage stage = BuildStage.UNINITIALIZED;
    private SampleSet incidences;
    private BsdfVolume volume;

    /**
     * @param measurements non-empty in-plane measurement set
     * @param wavelengths  non-empty ascending WavelengthSet
     * @param config       build options
     * @throws IllegalArgumentException if measurements or wavelengths are empty
     */
    public BsdfVolumeBuilder(List<MeasurementPoint> measurements,
                             SampleSet wavelengths,
                             BsdfBuildConfig config) {
        if (measurements == null) {
            throw new NullPointerException("measurements must not be null");
        }
        if (wavelengths == null) {
            throw new NullPointerException("wavelengths must not be null");
        }
        if (config == null) {
            throw new NullPointerException("config must not be null");
        }
        if (measurements.isEmpty()) {
            throw new IllegalArgumentException("measurement set must not be empty");
        }
        if (wavelengths.isEmpty()) {
            throw new IllegalArgumentException("wavelength set must not be empty");
        }
        this.measurements = List.copyOf(measurements);
        this.wavelengths = wavelengths;
        this.config = config;
    }

    public BsdfVolumeBuilder(List<MeasurementPoint> measurements, SampleSet wavelengths) {
        this(measurements, wavelengths, BsdfBuildConfig.defaults());
    }

    public BuildStage stage() { return stage; }

    /** Resolved IncidenceSet, or null before INCIDENCES_RESOLVED. */
    public SampleSet incidences() { return incidences; }

    /**
     * Runs the build.
     *
     * @throws BsdfBuildException    if any cell lacks data, the brdf is all zero, or a tensor
     *                               shape disagrees with the sample counts
     * @throws IllegalStateException if a previous build() failed
     */
    public BsdfVolume build() throws BsdfBuildException {
        if (stage == BuildStage.READY) {
            return volume;
        }
        if (stage == BuildStage.FAILED) {
            throw new IllegalStateException("build already failed; create a new builder");
        }
        try {
            return runBuild();
        } catch (BsdfBuildException | RuntimeException e) {
            stage = BuildStage.FAILED;
            log.debug("BSDF build failed: {}", e.getMessage());
            throw e;
        }
    }

    private BsdfVolume runBuild() throws BsdfBuildException {
        long start = System.nanoTime();
        AngularGrid grid = AngularGrid.fromSamplingStep(config.samplingStepDegrees());

        incidences = config.incidences() != null ? config.incidences() : resolveIncidences();
        stage = BuildStage.INCIDENCES_RESOLVED;

        int ni = incidences.size();
        int nw = wavelengths.size();
        CellResult[] cells = reconstructCells(grid, ni, nw);
        stage = BuildStage.PER_CELL_RECONSTRUCTED;

        // collect in iteration order; transmissive results only from cells that produced one
        List<PolarMap> reflectiveMaps = new ArrayList<>(cells.length);
        List<PolarMap> transmissiveMaps = new ArrayList<>();
        double[] reflectanceFlat = new double[cells.length];
        double[] transmittanceFlat = new double[cells.length];
        int transmissiveCount = 0;
        for (int k = 0; k < cells.length; k++) {
            CellResult cell = cells[k];
            reflectiveMaps.add(cell.reflectiveMap());
            reflectanceFlat[k] = cell.reflectance();
            if (cell.transmissiveMap() != null) {
                transmissiveMaps.add(cell.transmissiveMap());
                transmittanceFlat[transmissiveCount++] = cell.transmittance();
            }
        }
        boolean transmission = transmissiveCount > 0;

        int nt = grid.thetaCount();
        int np = grid.phiCount();
        double[][][][] brdf = TensorAssembly.swapLastAxes(
            TensorAssembly.reshape("brdf", reflectiveMaps, ni, nw, nt, np));
        double[][] reflectance = TensorAssembly.reshape("reflectance", reflectanceFlat, ni, nw);
        double[][][][] btdf = null;
        double[][] transmittance = null;
        if (transmission) {
            btdf = TensorAssembly.reverseFirstAxis(TensorAssembly.swapLastAxes(
                TensorAssembly.reshape("btdf", transmissiveMaps, ni, nw, nt, np)));
            transmittance = TensorAssembly.reshape("transmittance",
                Arrays.copyOf(transmittanceFlat, transmissiveCount), ni, nw);
        }
        stage = BuildStage.RESHAPED;

        validate(brdf, reflectance, btdf, transmittance, new int[] { ni, nw, np, nt });
        stage = BuildStage.VALIDATED;

        volume = new BsdfVolume(incidences, wavelengths, grid,
            brdf, reflectance, btdf, transmittance);
        stage = BuildStage.READY;
        log.info("Built BSDF volume: {} incidence(s) x {} wavelength(s) on {}, transmission={} in {} ms",
            ni, nw, grid, transmission, (System.nanoTime() - start) / 1_000_000L);
        return volume;
    }

    private SampleSet resolveIncidences() {
        List<Double> seen = new ArrayList<>();
        for (MeasurementPoint p : measurements) {
            seen.add(p.incidence());
        }
        SampleSet resolved = SampleSet.inOrder(seen);
        log.debug("Resolved {} incidence(s) from {} measurement point(s)",
            resolved.size(), measurements.size());
        return resolved;
    }

    // -- Per-cell reconstruction ----------------------------------------------

    private CellResult[] reconstructCells(AngularGrid grid, int ni, int nw)
        throws BsdfBuildException {
        AngularProfileFitter fitter = new AngularProfileFitter(measurements);
        CellResult[] slots = new CellResult[ni * nw];
        if (config.parallelism() <= 1 || slots.length <= 1) {
            for (int k = 0; k < slots.length; k++) {
                slots[k] = reconstructCell(fitter, grid,
                    incidences.get(k / nw), wavelengths.get(k % nw));
            }
            return slots;
        }

        ExecutorService pool = Executors.newFixedThreadPool(
            Math.min(config.parallelism(), slots.length));
        try {
            List<Future<?>> futures = new ArrayList<>(slots.length);
            for (int k = 0; k < slots.length; k++) {
                final int slot = k;
                futures.add(pool.submit(() -> {
                    slots[slot] = reconstructCell(fitter, grid,
                        incidences.get(slot / nw), wavelengths.get(slot % nw));
                    return null;
                }));
            }
            // wait for every task, then report the first failure in iteration order
            BsdfBuildException firstFailure = null;
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause();
                    if (cause instanceof BsdfBuildException buildFailure) {
                        if (firstFailure == null) {
                            firstFailure = buildFailure;
                        }
                    } else if (cause instanceof RuntimeException runtime) {
                        throw runtime;
                    } else {
                        throw new IllegalStateException("cell reconstruction failed", cause);
                    }
                }
            }
            if (firstFailure != null) {
                throw firstFailure;
            }
            return slots;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("BSDF build interrupted", e);
        } finally {
            pool.shutdownNow();
        }
    }

    private CellResult reconstructCell(AngularProfileFitter fitter, AngularGrid grid,
                                       double incidence, double wavelength)
        throws BsdfBuildException {
        ProfileFit fit = fitter.fit(incidence, wavelength);
        double tolerance = config.quadratureTolerance();

        PolarMap reflective = PolarReconstructor.reconstruct(
            fit.reflective(), incidence, wavelength, fit.thetaMax(), grid);
        double reflectance = HemisphericalIntegrator.integrate(grid, reflective, tolerance);

        PolarMap transmissive = null;
        double transmittance = 0.0;
        if (fit.hasTransmissive()) {
            transmissive = PolarReconstructor.reconstruct(
                fit.transmissive(), incidence, wavelength, fit.thetaMax(), grid);
            transmittance = HemisphericalIntegrator.integrate(grid, transmissive, tolerance);
        }
        log.debug("Cell incidence={} wavelength={}: reflectance={} transmittance={}",
            incidence, wavelength, reflectance,
            transmissive == null ? "n/a" : transmittance);
        return new CellResult(reflective, reflectance, transmissive, transmittance);
    }

    // -- Validation -----------------------------------------------------------

    private static void validate(double[][][][] brdf, double[][] reflectance,
                                 double[][][][] btdf, double[][] transmittance,
                                 int[] expected) throws BsdfBuildException {
        if (TensorAssembly.isAllZero(brdf)) {
            throw new AllZeroDataException(Branch.REFLECTIVE);
        }
        requireShape("brdf", expected, TensorAssembly.shape(brdf));
        int[] expectedScalar = { expected[0], expected[1] };
        requireShape("reflectance", expectedScalar, TensorAssembly.shape(reflectance));
        if (btdf != null) {
            if (TensorAssembly.isAllZero(btdf)) {
                log.warn("All values of the btdf tensor are zero; treating the material as opaque");
            }
            requireShape("btdf", expected, TensorAssembly.shape(btdf));
            requireShape("transmittance", expectedScalar, TensorAssembly.shape(transmittance));
        }
    }

    private static void requireShape(String tensor, int[] expected, int[] actual)
        throws ShapeMismatchException {
        if (!Arrays.equals(expected, actual)) {
            throw new ShapeMismatchException(tensor, expected, actual);
        }
    }

    private record CellResult(
        PolarMap reflectiveMap,
        double reflectance,
        PolarMap transmissiveMap,
        double transmittance
    ) {}
}
