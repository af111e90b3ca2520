package com.umitunal.qdelay.worker;

import java.util.List;

/**
 * Hands a due job to the execution engine.
 *
 * <p>Implementations typically push onto a ready queue; in inline mode they
 * may run the job on the calling thread.
 */
@FunctionalInterface
public interface JobExecutor {

    /**
     * Execute or enqueue a job.
     *
     * @param queue destination queue name
     * @param className execution target
     * @param args job arguments
     * @throws Exception if the job could not be handed over
     */
    void execute(String queue, String className, List<Object> args) throws Exception;
}
