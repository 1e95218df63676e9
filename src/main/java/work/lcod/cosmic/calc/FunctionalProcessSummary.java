package work.lcod.cosmic.calc;

/**
 * Movement counts and CFP total for one functional process.
 */
public record FunctionalProcessSummary(
    String name,
    long entryCount,
    long exitCount,
    long readCount,
    long writeCount,
    int totalCfp,
    String trigger,
    String objectOfInterest,
    String description
) {}
