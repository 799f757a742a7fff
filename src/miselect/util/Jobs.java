package miselect.util;

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.ForkJoinTask;
import java.util.concurrent.RecursiveAction;

import miselect.MIException;

import com.google.common.base.Throwables;

/**
 * Runs independent units of work (alpha paths, cross-validation folds) on a
 * private fork/join pool and waits for all of them.
 */
public final class Jobs {
  private Jobs(){}

  public static void invokeAll(final List<? extends RecursiveAction> jobs, int nthreads){
    if(jobs.isEmpty())return;
    if(nthreads <= 1 || jobs.size() == 1){
      for(RecursiveAction job:jobs)
        job.invoke();
      return;
    }
    ForkJoinPool pool = new ForkJoinPool(Math.min(nthreads, jobs.size()));
    try {
      pool.submit(new RecursiveAction() {
        @Override protected void compute() {
          ForkJoinTask.invokeAll(jobs);
        }
      }).get();
    } catch( InterruptedException e ) {
      Thread.currentThread().interrupt();
      throw new MIException("interrupted while waiting for fit jobs", e);
    } catch( ExecutionException e ) {
      Throwables.throwIfUnchecked(e.getCause());
      throw new MIException("fit job failed", e.getCause());
    } finally {
      pool.shutdown();
    }
  }
}
