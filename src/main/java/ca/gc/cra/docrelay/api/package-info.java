/**
 * Command-line entry points: {@link ca.gc.cra.docrelay.api.Main} dispatches to {@code publish} and
 * {@code consume}. Arguments use the {@code key=value} style with {@code --flags}.
 */
package ca.gc.cra.docrelay.api;
