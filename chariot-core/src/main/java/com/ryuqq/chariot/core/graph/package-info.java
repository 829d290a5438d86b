/**
 * Component graph package.
 *
 * <p>Turns initializer declarations into constructed components.</p>
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>{@link com.ryuqq.chariot.core.graph.GraphBuilder} - classifies declarations, fills the
 *       {@link com.ryuqq.chariot.core.graph.Registry}, rejects duplicate kinds</li>
 *   <li>{@link com.ryuqq.chariot.core.graph.DependencyResolver} - depth-first, memoized construction
 *       with missing-dependency and cycle detection</li>
 *   <li>{@link com.ryuqq.chariot.core.graph.ActionInvoker} - runs zero-product initializers in declaration order</li>
 * </ol>
 *
 * <p>{@link com.ryuqq.chariot.core.graph.Capabilities} collects runners and shutdowners as
 * components finish construction.</p>
 *
 * <p>All types here are used during assembly only, which is single-threaded.</p>
 *
 * @since 1.0.0
 * @author Chariot Team
 */
package com.ryuqq.chariot.core.graph;
