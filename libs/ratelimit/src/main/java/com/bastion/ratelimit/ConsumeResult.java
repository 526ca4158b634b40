package com.bastion.ratelimit;

/**
 * Result of one atomic refill-and-decrement.
 *
 * @param admitted whether a token was taken
 * @param tokens   tokens left after the operation (after the decrement when admitted)
 */
public record ConsumeResult(boolean admitted, double tokens) {
}
