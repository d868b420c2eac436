package com.simtrade.core.market;

/**
 * One link in the resolution chain. A step prices whatever pending symbols it
 * can and leaves the rest for the next step.
 */
interface ResolutionStep {

    String name();

    void resolve(ResolutionContext context);
}
