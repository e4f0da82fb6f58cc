package software.amazon.policy.ruler;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A CharSequence view of a candidate string that aborts regex evaluation once a deadline has passed. The
 * java.util.regex engine reads its input exclusively through charAt, so a runaway backtracking search keeps calling
 * back into this class and gets interrupted by the exception thrown here.
 *
 * One instance serves one evaluation; sub-sequences share the deadline of their parent.
 */
@NotThreadSafe
final class DeadlineCharSequence implements CharSequence {

    // Reading the clock on every character would dominate short matches.
    private static final int CHECK_INTERVAL_MASK = 0xFF;

    private final CharSequence delegate;
    private final long deadlineNanos;
    private final CompiledPattern owner;
    private int reads;

    DeadlineCharSequence(final CharSequence delegate, final long deadlineNanos, final CompiledPattern owner) {
        this.delegate = delegate;
        this.deadlineNanos = deadlineNanos;
        this.owner = owner;
    }

    @Override
    public char charAt(final int index) {
        if ((++reads & CHECK_INTERVAL_MASK) == 0 && System.nanoTime() - deadlineNanos > 0) {
            throw new MatchTimeoutException(owner.source(), owner.timeout());
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(final int start, final int end) {
        return new DeadlineCharSequence(delegate.subSequence(start, end), deadlineNanos, owner);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
