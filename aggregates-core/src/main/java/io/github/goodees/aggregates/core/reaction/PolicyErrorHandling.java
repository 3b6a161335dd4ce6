package io.github.goodees.aggregates.core.reaction;

/*-
 * #%L
 * aggregates-core
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

/**
 * Tolerance of a policy to failing commands issued in reaction to a single event.
 */
public final class PolicyErrorHandling {
    public enum Mode {
        /**
         * First failed command fails the event.
         */
        FAIL_FAST,
        /**
         * Failed commands are logged, the event always succeeds.
         */
        CONTINUE_ON_ERROR,
        /**
         * The event fails when more than maxErrors commands fail.
         */
        CONTINUE_UNTIL_MAX_ERRORS,
        /**
         * The event fails when ratio of failed commands exceeds max failure rate.
         */
        CONTINUE_UNTIL_MAX_FAILURE_RATE
    }

    private static final PolicyErrorHandling FAIL_FAST = new PolicyErrorHandling(Mode.FAIL_FAST, 1, .1);

    private final Mode mode;
    private final int maxErrors;
    private final double maxFailureRate;

    private PolicyErrorHandling(Mode mode, int maxErrors, double maxFailureRate) {
        this.mode = mode;
        this.maxErrors = maxErrors;
        this.maxFailureRate = maxFailureRate;
    }

    public static PolicyErrorHandling failFast() {
        return FAIL_FAST;
    }

    public static PolicyErrorHandling continueOnError() {
        return new PolicyErrorHandling(Mode.CONTINUE_ON_ERROR, 1, .1);
    }

    public static PolicyErrorHandling continueUntilMaxErrors() {
        return continueUntilMaxErrors(1);
    }

    public static PolicyErrorHandling continueUntilMaxErrors(int maxErrors) {
        if (maxErrors < 0) {
            throw new IllegalArgumentException("Max errors must not be negative");
        }
        return new PolicyErrorHandling(Mode.CONTINUE_UNTIL_MAX_ERRORS, maxErrors, .1);
    }

    public static PolicyErrorHandling continueUntilMaxFailureRate() {
        return continueUntilMaxFailureRate(.1);
    }

    public static PolicyErrorHandling continueUntilMaxFailureRate(double maxFailureRate) {
        if (maxFailureRate < 0 || maxFailureRate > 1) {
            throw new IllegalArgumentException("Failure rate must be between 0 and 1, was " + maxFailureRate);
        }
        return new PolicyErrorHandling(Mode.CONTINUE_UNTIL_MAX_FAILURE_RATE, 1, maxFailureRate);
    }

    public Mode getMode() {
        return mode;
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public double getMaxFailureRate() {
        return maxFailureRate;
    }

    /**
     * Start counting errors of one event.
     * @param batchSize number of commands issued for the event
     * @return fresh error budget
     */
    public ErrorBudget budgetFor(int batchSize) {
        return new ErrorBudget(batchSize);
    }

    @Override
    public String toString() {
        switch (mode) {
            case CONTINUE_UNTIL_MAX_ERRORS:
                return mode + "(" + maxErrors + ")";
            case CONTINUE_UNTIL_MAX_FAILURE_RATE:
                return mode + "(" + maxFailureRate + ")";
            default:
                return mode.toString();
        }
    }

    /**
     * Errors counted for single event.
     */
    public final class ErrorBudget {
        private final int batchSize;
        private int errors;

        ErrorBudget(int batchSize) {
            this.batchSize = batchSize;
        }

        /**
         * Count a failed command.
         * @return true when processing of the event may continue
         */
        public boolean tolerate() {
            errors++;
            switch (mode) {
                case CONTINUE_ON_ERROR:
                    return true;
                case CONTINUE_UNTIL_MAX_ERRORS:
                    return errors <= maxErrors;
                case CONTINUE_UNTIL_MAX_FAILURE_RATE:
                    return (double) errors / Math.max(batchSize, 1) <= maxFailureRate + Double.MIN_VALUE;
                default:
                    return false;
            }
        }

        public int getErrors() {
            return errors;
        }
    }
}
