package com.topostat.core.normalize;

import com.topostat.core.error.Attempt;
import com.topostat.core.error.ErrorKind;
import com.topostat.core.model.ResultRecord;
import com.topostat.core.persistence.AgentRow;
import com.topostat.core.persistence.BuildRow;
import com.topostat.core.persistence.Dimension;
import com.topostat.core.persistence.DirectoryRow;
import com.topostat.core.persistence.JobRow;
import com.topostat.core.persistence.ModuleRow;
import com.topostat.core.persistence.NaturalKey;
import com.topostat.core.persistence.PlanRow;
import com.topostat.core.persistence.ResultFact;
import com.topostat.core.persistence.ResultStore;
import com.topostat.core.persistence.TestRow;
import com.topostat.core.persistence.UnitOfWork;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

/**
 * Resolves the dimensions a validated record references and links them to a new fact row.
 * <p>
 * Dimensions are resolved in the order directory, module, test, agent, plan, build, job.
 * Each is looked up in the {@link BatchContext} first, then in the {@link ResultStore},
 * and only then created and queued in the returned {@link UnitOfWork}.
 */
@Service
public class Normalizer {

    private static final Logger log = LoggerFactory.getLogger(Normalizer.class);

    private final ResultStore store;

    public Normalizer(ResultStore store) {
        this.store = store;
    }

    public Attempt<UnitOfWork> normalize(ResultRecord record, BatchContext batch) {
        if (record == null || !record.validate()) {
            return Attempt.fail(ErrorKind.NORMALIZATION, "Record is not valid: " + record);
        }
        Attempt<TestName> parsed = TestName.parse(record.name());
        if (!parsed.isOk()) {
            return Attempt.fail(parsed.error(), parsed.message());
        }
        TestName name = parsed.value();
        String agentName = record.agentName().strip();
        String planName = record.planName().strip();
        String jobName = record.jobName().strip();
        if (agentName.isEmpty() || planName.isEmpty() || jobName.isEmpty()) {
            return Attempt.fail(ErrorKind.NORMALIZATION, "Blank agent, plan or job name in " + record.name());
        }

        UnitOfWork work = new UnitOfWork();

        try {
            DirectoryRow directory = resolve(NaturalKey.directory(name.directory()), DirectoryRow.class,
                    () -> new DirectoryRow(name.directory()), batch, work);
            ModuleRow module = resolve(NaturalKey.module(name.module(), directory.getName()), ModuleRow.class,
                    () -> new ModuleRow(name.module(), directory), batch, work);
            TestRow test = resolve(NaturalKey.test(name.test(), module.getName(), directory.getName()), TestRow.class,
                    () -> new TestRow(name.test(), module, directory), batch, work);
            AgentRow agent = resolve(NaturalKey.agent(agentName), AgentRow.class,
                    () -> new AgentRow(agentName), batch, work);
            PlanRow plan = resolve(NaturalKey.plan(planName), PlanRow.class,
                    () -> new PlanRow(planName), batch, work);
            BuildRow build = resolve(NaturalKey.build(record.buildNumber(), plan.getName()), BuildRow.class,
                    () -> new BuildRow(record.buildNumber(), plan), batch, work);
            JobRow job = resolve(NaturalKey.job(jobName, plan.getName()), JobRow.class,
                    () -> new JobRow(jobName, plan), batch, work);

            ResultFact fact = new ResultFact(directory, module, test, agent, plan, build, job,
                    record.outcome(), record.durationSeconds(), record.timestamp(), record.platform());
            if (!fact.isValid()) {
                batch.evict(work);
                return Attempt.fail(ErrorKind.NORMALIZATION, "Fact references an invalid dimension: " + record.name());
            }
            work.setFact(fact);
            log.debug("Normalized '{}' with {} new dimension(s)", record.name(), work.getCreated().size());
            return Attempt.ok(work);
        } catch (DataAccessException e) {
            batch.evict(work);
            log.error("Store lookup failed while normalizing '{}'", record.name(), e);
            return Attempt.fail(ErrorKind.PERSISTENCE, e.getMessage());
        }
    }

    private <T extends Dimension> T resolve(NaturalKey key, Class<T> type, Supplier<T> factory,
                                            BatchContext batch, UnitOfWork work) {
        var cached = batch.get(key, type);
        if (cached.isPresent()) {
            return cached.get();
        }
        var stored = store.find(key, type);
        if (stored.isPresent()) {
            batch.put(stored.get());
            return stored.get();
        }
        T created = work.create(factory.get());
        batch.put(created);
        return created;
    }
}
