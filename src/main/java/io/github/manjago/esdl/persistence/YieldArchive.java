package io.github.manjago.esdl.persistence;

import io.github.manjago.esdl.core.Genome;
import io.github.manjago.esdl.core.Individual;
import io.github.manjago.esdl.core.Population;
import io.github.manjago.esdl.core.RandomStreams;
import io.github.manjago.esdl.core.SpeciesKind;
import io.github.manjago.esdl.core.StreamRng.StreamState;
import io.github.manjago.esdl.run.RunStats;
import io.github.manjago.esdl.run.TerminationReason;
import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Archive of YIELD checkpoints using H2 MVStore.
 *
 * Structure:
 * - "meta" map: version, seeds and run counters
 * - "run" map: pipeline definition, landscape name, termination reason
 * - "yields" map: one entry per yielded population, keyed by sequence number
 * - "rng" map: both stream states at each yield, keyed "sequence.stream"
 *
 * Each yield entry holds the generation, the population name and every member's
 * genome, fitness and birth number. Entries are committed as they are written, so an
 * interrupted run still leaves a readable archive.
 */
public class YieldArchive implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(YieldArchive.class);

    private static final int VERSION = 1;

    // Meta keys
    private static final String KEY_VERSION = "version";
    private static final String KEY_BREEDING_SEED = "breeding_seed";
    private static final String KEY_LANDSCAPE_SEED = "landscape_seed";
    private static final String KEY_GENERATIONS = "generations";
    private static final String KEY_BIRTHS = "births";
    private static final String KEY_EVALUATIONS = "evaluations";

    // Run keys
    private static final String KEY_DEFINITION = "definition";
    private static final String KEY_LANDSCAPE = "landscape";
    private static final String KEY_TERMINATION = "termination";

    private final Path path;
    private final MVStore store;
    private final MVMap<String, Long> meta;
    private final MVMap<String, String> run;
    private final MVMap<Long, byte[]> yields;
    private final MVMap<String, byte[]> rng;

    // Streams of the recorded run, captured at every yield
    private @Nullable RandomStreams streams;

    private YieldArchive(Path path, MVStore store) {
        this.path = path;
        this.store = store;
        this.meta = store.openMap("meta");
        this.run = store.openMap("run");
        this.yields = store.openMap("yields");
        this.rng = store.openMap("rng");
    }

    /**
     * Create a new archive, replacing any file at the path.
     */
    public static YieldArchive create(Path path) throws IOException {
        Files.deleteIfExists(path);
        MVStore store = new MVStore.Builder()
                .fileName(path.toString())
                .compress()
                .open();
        YieldArchive archive = new YieldArchive(path, store);
        archive.meta.put(KEY_VERSION, (long) VERSION);
        store.commit();
        log.info("Yield archive created at {}", path);
        return archive;
    }

    // ========== Writing ==========

    /**
     * Record what is needed to repeat the run: seeds, definition and landscape.
     */
    public void recordRun(RandomStreams streams, String definition, String landscape) {
        this.streams = streams;
        meta.put(KEY_BREEDING_SEED, streams.breedingSeed());
        meta.put(KEY_LANDSCAPE_SEED, streams.landscapeSeed());
        run.put(KEY_DEFINITION, definition);
        run.put(KEY_LANDSCAPE, landscape);
        store.commit();
    }

    /**
     * Append one yielded population.
     */
    public void recordYield(String name, Population population, long generation) {
        long sequence = yields.size();
        yields.put(sequence, serializeYield(name, population, generation));
        if (streams != null) {
            rng.put(rngKey(sequence, RandomStreams.BREEDING), streams.breeding().saveState().toBytes());
            rng.put(rngKey(sequence, RandomStreams.LANDSCAPE), streams.landscape().saveState().toBytes());
        }
        store.commit();
        log.debug("Archived yield #{}: {} ({} individuals, generation {})",
                sequence, name, population.size(), generation);
    }

    public void recordTermination(TerminationReason reason, RunStats stats) {
        meta.put(KEY_GENERATIONS, stats.generation());
        meta.put(KEY_BIRTHS, stats.births());
        meta.put(KEY_EVALUATIONS, stats.evaluations());
        run.put(KEY_TERMINATION, reason.name());
        store.commit();
    }

    public Path getPath() {
        return path;
    }

    @Override
    public void close() {
        store.close();
        log.info("Yield archive closed: {} yields in {}", yields.size(), path);
    }

    // ========== Reading ==========

    /**
     * Load the whole archive.
     */
    public static ArchiveData load(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Archive not found: " + path);
        }
        log.info("Loading yield archive from {}", path);

        try (MVStore store = new MVStore.Builder().fileName(path.toString()).readOnly().open()) {
            MVMap<String, Long> meta = store.openMap("meta");
            int version = meta.getOrDefault(KEY_VERSION, 0L).intValue();
            if (version < 1 || version > VERSION) {
                throw new IOException("Unsupported archive version: " + version);
            }

            MVMap<String, String> run = store.openMap("run");
            MVMap<Long, byte[]> yieldMap = store.openMap("yields");
            MVMap<String, byte[]> rngMap = store.openMap("rng");
            List<YieldRecord> records = new ArrayList<>();
            for (Long sequence : yieldMap.keySet()) {
                records.add(deserializeYield(yieldMap.get(sequence),
                        readState(rngMap, rngKey(sequence, RandomStreams.BREEDING)),
                        readState(rngMap, rngKey(sequence, RandomStreams.LANDSCAPE))));
            }

            String termination = run.get(KEY_TERMINATION);
            return new ArchiveData(
                version,
                meta.getOrDefault(KEY_BREEDING_SEED, RandomStreams.DEFAULT_SEED),
                meta.getOrDefault(KEY_LANDSCAPE_SEED, RandomStreams.DEFAULT_SEED),
                run.getOrDefault(KEY_DEFINITION, ""),
                run.getOrDefault(KEY_LANDSCAPE, "none"),
                termination == null ? null : TerminationReason.valueOf(termination),
                meta.getOrDefault(KEY_GENERATIONS, 0L),
                records
            );
        }
    }

    /**
     * One-line summary without decoding the yields.
     */
    public static String getInfo(Path path) {
        try (MVStore store = new MVStore.Builder().fileName(path.toString()).readOnly().open()) {
            MVMap<String, Long> meta = store.openMap("meta");
            MVMap<String, String> run = store.openMap("run");
            MVMap<Long, byte[]> yieldMap = store.openMap("yields");
            return String.format("Archive v%d: %,d yields, %,d generations, seeds %d/%d, %s",
                    meta.getOrDefault(KEY_VERSION, 0L),
                    yieldMap.size(),
                    meta.getOrDefault(KEY_GENERATIONS, 0L),
                    meta.getOrDefault(KEY_BREEDING_SEED, 0L),
                    meta.getOrDefault(KEY_LANDSCAPE_SEED, 0L),
                    run.getOrDefault(KEY_TERMINATION, "unfinished"));
        } catch (Exception e) {
            return "Invalid archive: " + e.getMessage();
        }
    }

    // ========== Private helpers ==========

    private static String rngKey(long sequence, String stream) {
        return sequence + "." + stream;
    }

    private static @Nullable StreamState readState(MVMap<String, byte[]> rngMap, String key) {
        byte[] bytes = rngMap.get(key);
        return bytes == null ? null : StreamState.fromBytes(bytes);
    }

    private static byte[] serializeYield(String name, Population population, long generation) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream();
             DataOutputStream out = new DataOutputStream(baos)) {

            out.writeLong(generation);
            out.writeUTF(name);
            out.writeInt(population.size());
            for (Individual individual : population) {
                out.writeLong(individual.getBirth());
                out.writeDouble(individual.getFitness());
                writeGenome(out, individual.getGenome());
            }
            out.flush();
            return baos.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static YieldRecord deserializeYield(byte[] data, @Nullable StreamState breeding,
                                                @Nullable StreamState landscape) throws IOException {
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            long generation = in.readLong();
            String name = in.readUTF();
            int count = in.readInt();
            List<ArchivedIndividual> members = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                long birth = in.readLong();
                double fitness = in.readDouble();
                members.add(new ArchivedIndividual(readGenome(in), fitness, birth));
            }
            return new YieldRecord(generation, name, members, breeding, landscape);
        }
    }

    private static void writeGenome(DataOutputStream out, Genome genome) throws IOException {
        out.writeUTF(genome.getKind().getShortName());
        out.writeDouble(genome.getLowest());
        out.writeDouble(genome.getHighest());
        out.writeInt(genome.length());
        switch (genome.getKind()) {
            case BINARY -> {
                for (boolean bit : genome.bits()) {
                    out.writeBoolean(bit);
                }
            }
            case INTEGER, GE -> {
                for (int gene : genome.ints()) {
                    out.writeInt(gene);
                }
            }
            case REAL -> {
                for (double gene : genome.reals()) {
                    out.writeDouble(gene);
                }
            }
        }
    }

    private static Genome readGenome(DataInputStream in) throws IOException {
        String shortName = in.readUTF();
        SpeciesKind kind = SpeciesKind.fromShortName(shortName);
        if (kind == null) {
            throw new IOException("Unknown genome kind in archive: " + shortName);
        }
        double lowest = in.readDouble();
        double highest = in.readDouble();
        int length = in.readInt();
        return switch (kind) {
            case BINARY -> {
                boolean[] bits = new boolean[length];
                for (int i = 0; i < length; i++) {
                    bits[i] = in.readBoolean();
                }
                yield Genome.binary(bits);
            }
            case INTEGER, GE -> {
                int[] genes = new int[length];
                for (int i = 0; i < length; i++) {
                    genes[i] = in.readInt();
                }
                yield kind == SpeciesKind.GE
                        ? Genome.codons(genes, (int) lowest, (int) highest)
                        : Genome.integers(genes, (int) lowest, (int) highest);
            }
            case REAL -> {
                double[] genes = new double[length];
                for (int i = 0; i < length; i++) {
                    genes[i] = in.readDouble();
                }
                yield Genome.reals(genes, lowest, highest);
            }
        };
    }

    // ========== Data records ==========

    /**
     * Archived individual; fitness is NaN if it was never evaluated.
     */
    public record ArchivedIndividual(Genome genome, double fitness, long birth) {
    }

    /**
     * One archived yield. Stream states are null when the run was not recorded with
     * {@link #recordRun}.
     */
    public record YieldRecord(
        long generation,
        String population,
        List<ArchivedIndividual> individuals,
        @Nullable StreamState breedingState,
        @Nullable StreamState landscapeState
    ) {

        /**
         * Streams positioned as they were right after this yield.
         *
         * @throws IllegalStateException if no stream state was archived
         */
        public RandomStreams restoreStreams() {
            if (breedingState == null || landscapeState == null) {
                throw new IllegalStateException("No stream state archived for this yield");
            }
            return RandomStreams.restore(breedingState, landscapeState);
        }

        public double bestFitness() {
            return individuals.stream()
                    .mapToDouble(ArchivedIndividual::fitness)
                    .filter(f -> !Double.isNaN(f))
                    .max()
                    .orElse(Double.NaN);
        }
    }

    public record ArchiveData(
        int version,
        long breedingSeed,
        long landscapeSeed,
        String definition,
        String landscape,
        @Nullable TerminationReason termination,
        long generations,
        List<YieldRecord> yields
    ) {

        /**
         * Yields of one population in archive order.
         */
        public List<YieldRecord> yieldsOf(String population) {
            return yields.stream()
                    .filter(r -> r.population().equals(population))
                    .toList();
        }
    }
}
