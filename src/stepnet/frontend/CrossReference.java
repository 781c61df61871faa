package stepnet.frontend;

import java.util.List;

/**
 * Reference to one or more steps of another program, written as {@code description (Program STEP 3+4)}.
 * @param programName the referenced program
 * @param stepNumbers the referenced step numbers, in order of appearance without duplicates
 * @param lineNumber the line the reference was found on
 */
public record CrossReference(String programName, List<Integer> stepNumbers, int lineNumber) {
  public CrossReference {
    stepNumbers = List.copyOf(stepNumbers);
  }
}
