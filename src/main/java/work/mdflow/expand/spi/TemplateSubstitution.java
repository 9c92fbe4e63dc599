package work.mdflow.expand.spi;

import java.util.Map;

/**
 * Template stage run between content expansion and command expansion.
 */
@FunctionalInterface
public interface TemplateSubstitution {
    String substitute(String text, Map<String, String> variables);
}
