package com.acme.workqueue;

import io.micronaut.runtime.Micronaut;

/**
 * Worker Application - hosts the queue consumer and the admin HTTP endpoints. Any number of
 * instances may run against the same database; the claim protocol keeps them from processing the
 * same message twice.
 */
public class WorkerApplication {
  public static void main(String[] args) {
    Micronaut.run(WorkerApplication.class, args);
  }
}
