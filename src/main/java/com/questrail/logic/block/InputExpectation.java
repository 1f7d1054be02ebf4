package com.questrail.logic.block;

/**
 * Expected shape of one input in {@link CBlock#checkSignature(java.util.Map)}:
 * a single input, or a group with an exact or ranged member count.
 */
public final class InputExpectation
{
    private static final InputExpectation SINGLE = new InputExpectation(false, null, null);

    private final boolean group;
    private final Integer min;
    private final Integer max;

    private InputExpectation(boolean group, Integer min, Integer max)
    {
        if (min != null && max != null && min > max) {
            throw new IllegalArgumentException("group minimum " + min + " exceeds maximum " + max);
        }
        this.group = group;
        this.min = min;
        this.max = max;
    }

    public static InputExpectation single()
    {
        return SINGLE;
    }

    public static InputExpectation group(int count)
    {
        return new InputExpectation(true, count, count);
    }

    /**
     * Group with a member count range; {@code null} bounds are open.
     */
    public static InputExpectation groupBetween(Integer min, Integer max)
    {
        return new InputExpectation(true, min, max);
    }

    public static InputExpectation groupAtLeast(int min)
    {
        return groupBetween(min, null);
    }

    public static InputExpectation anyGroup()
    {
        return groupBetween(null, null);
    }

    /**
     * Describes the mismatch with an actual input, {@code null} when it matches.
     *
     * @param actualSize group size, or {@code null} for a single input
     */
    String mismatch(String name, Integer actualSize)
    {
        if (!group) {
            return actualSize == null ? null : name + ": is a group, expected was a single input";
        }
        if (actualSize == null) {
            return name + ": is a single input, expected was a group";
        }
        if (min != null && min.equals(max)) {
            return actualSize.equals(min)
                    ? null
                    : "group " + name + ": input count is " + actualSize + ", expected was " + min;
        }
        if (min != null && actualSize < min) {
            return "group " + name + ": input count is " + actualSize + ", minimum is " + min;
        }
        if (max != null && actualSize > max) {
            return "group " + name + ": input count is " + actualSize + ", maximum is " + max;
        }
        return null;
    }
}
