package com.myorg.fanout.engine.hydrate;

import com.myorg.fanout.engine.access.AccessPredicate;
import com.myorg.fanout.engine.join.Joiner;

import java.util.concurrent.Executor;

/**
 * Collaborators shared by all variant hydrators.
 */
public record HydrationSupport(Joiner joiner, AccessPredicate access, Executor executor, int commentLimit) {
}
