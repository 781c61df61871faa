package stepnet.frontend;

/**
 * Closed step variant: the single REST (home) step, which is implicitly step 0, or a numbered sequential step.
 */
public interface StepKind {
  record Rest() implements StepKind {
    @Override
    public int number() {
      return 0;
    }
  }

  record Sequential(int number) implements StepKind {
    public Sequential {
      if (number < 0)
        throw new IllegalArgumentException("step number must not be negative: " + number);
    }
  }

  static final Rest REST = new Rest();

  /** The step bit index: 0 for REST, the declared number otherwise. */
  int number();

  default boolean isRest() { return this instanceof Rest; }
}
