/**
 * Rule contracts, the built-in rules and the registry that indexes them.
 *
 * <p>
 * Every rule implements {@link com.mapobserver.core.rule.ObserverRule}.
 * Rules that keep per-observer state such as budgets also implement
 * {@link com.mapobserver.core.rule.StatefulObserverRule}. Built-in rules:
 * </p>
 * <ul>
 * <li>{@link com.mapobserver.core.rule.TimeRangeRule}: daily visibility
 * window</li>
 * <li>{@link com.mapobserver.core.rule.TimeLimitRule}: visibility budget in
 * seconds from first use</li>
 * <li>{@link com.mapobserver.core.rule.RequestLimitRule}: visibility budget
 * in requests</li>
 * <li>{@link com.mapobserver.core.rule.ObjectIdRule}: object allow-list</li>
 * <li>{@link com.mapobserver.core.rule.SideIdRule}: side allow-list</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.mapobserver.core.rule;
