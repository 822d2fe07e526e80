package org.janelia.fuzzer.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.janelia.fuzzer.json.JsonUtils;

/**
 * Base parameters for all command line tools.
 *
 * @author Eric Trautman
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    private transient JCommander jCommander;

    public CommandLineParameters() {
        this.help = false;
        this.jCommander = null;
    }

    /**
     * Parses arguments for the class enclosing this parameters class,
     * exiting the process with usage information when parsing fails or help is requested.
     */
    public void parse(final String[] args) throws IllegalArgumentException {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * @throws IllegalArgumentException
     *   if the arguments cannot be parsed and the process should not exit.
     */
    public void parse(final String[] args,
                      final Class<?> programClass,
                      final boolean exitOnHelpOrFailure) throws IllegalArgumentException {

        jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp fuzzer-client-standalone.jar " + programClass.getName());

        ParameterException parseFailure = null;
        try {
            jCommander.parse(args);
        } catch (final ParameterException pe) {
            parseFailure = pe;
            jCommander.getConsole().println("\nERROR: failed to parse command line arguments\n\n" + pe.getMessage());
        }

        if (help || (parseFailure != null)) {
            jCommander.getConsole().println("");
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            }
        }

        if (parseFailure != null) {
            throw new IllegalArgumentException(parseFailure.getMessage(), parseFailure);
        }
    }

    /**
     * @return string representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Helper (no pun intended) for testing parameter parsing.
     *
     * @param  parameters  parameters instance to test.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

}
