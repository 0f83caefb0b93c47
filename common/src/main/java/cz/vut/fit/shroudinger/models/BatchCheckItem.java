package cz.vut.fit.shroudinger.models;

import cz.vut.fit.shroudinger.errors.ErrorKind;
import org.jetbrains.annotations.Nullable;

/**
 * One element of a batch check, in the order of the request.
 *
 * @param index  The position of the name in the request.
 * @param result The verdict, or null if the name was rejected.
 * @param error  The error kind if the name was rejected, otherwise null.
 */
public record BatchCheckItem(int index, @Nullable MatchResult result, @Nullable ErrorKind error) {
}
