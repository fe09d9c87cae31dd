package com.ivamare.connect.job;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a bean method as a named background job.
 *
 * <p>The method must have the signature {@code void methodName(Map<String, Object> args)}.
 *
 * <pre>
 * &#64;Component
 * public class LoanJobs {
 *
 *     &#64;ConnectJob("loan.sync-repayment")
 *     public void syncRepayment(Map&lt;String, Object&gt; args) {
 *         Map&lt;String, Object&gt; context = (Map&lt;String, Object&gt;) args.get("context");
 *         ...
 *     }
 * }
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface ConnectJob {

    /**
     * The job name used by job requests and handler actions.
     */
    String value();
}
