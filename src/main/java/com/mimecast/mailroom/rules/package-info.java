/**
 * Rule chains deciding the fate of list postings.
 *
 * <p>A {@link com.mimecast.mailroom.rules.Chain} is an ordered list of rule and action links.
 * <br>The first hit with a terminal action decides the {@link com.mimecast.mailroom.rules.Verdict}.
 *
 * @see com.mimecast.mailroom.rules.ChainEvaluator
 * @see com.mimecast.mailroom.rules.RuleRegistry
 */
package com.mimecast.mailroom.rules;
