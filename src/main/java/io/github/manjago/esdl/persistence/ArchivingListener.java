package io.github.manjago.esdl.persistence;

import io.github.manjago.esdl.core.Population;
import io.github.manjago.esdl.run.PipelineListener;
import io.github.manjago.esdl.run.RunStats;
import io.github.manjago.esdl.run.TerminationReason;

/**
 * Writes every YIELD of a run into a {@link YieldArchive}.
 */
public class ArchivingListener implements PipelineListener {

    private final YieldArchive archive;

    public ArchivingListener(YieldArchive archive) {
        this.archive = archive;
    }

    @Override
    public void onYield(String name, Population population, long generation) {
        archive.recordYield(name, population, generation);
    }

    @Override
    public void onTerminated(TerminationReason reason, RunStats stats) {
        archive.recordTermination(reason, stats);
    }
}
