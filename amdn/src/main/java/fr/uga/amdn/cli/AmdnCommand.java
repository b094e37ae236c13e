package fr.uga.amdn.cli;

import fr.uga.amdn.ExtractionException;
import fr.uga.amdn.cnf.WcnfWriter;
import fr.uga.amdn.extract.Amdn;
import fr.uga.amdn.extract.EncodedProblem;
import fr.uga.amdn.extract.ExtractionSettings;
import fr.uga.amdn.model.Model;
import fr.uga.amdn.model.ModelSerializer;
import fr.uga.amdn.observation.ObservationLists;
import fr.uga.amdn.observation.ObservationReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@CommandLine.Command(name = "amdn",
        version = "AMDN 1.0",
        description = "Learns an action model from noisy, partial and disordered parallel traces.",
        sortOptions = false,
        mixinStandardHelpOptions = true)
public class AmdnCommand implements Callable<Integer> {

    private static final Logger LOGGER = LogManager.getLogger(AmdnCommand.class.getName());

    @CommandLine.Parameters(index = "0", paramLabel = "<observations>",
        description = "JSON file holding the observed traces and the disorder probabilities")
    private Path observationFile;

    @CommandLine.Option(names = {"-t", "--threshold"}, defaultValue = "1",
        paramLabel = "<threshold>", description = "Occurrence threshold of the noise constraints (default: ${DEFAULT-VALUE})")
    private int occurrenceThreshold = ExtractionSettings.DEFAULT_OCCURRENCE_THRESHOLD;

    @CommandLine.Option(names = {"-T", "--timeout"}, defaultValue = "300",
        paramLabel = "<seconds>", description = "Total time given to the solver (default: ${DEFAULT-VALUE})")
    private int timeoutSec = ExtractionSettings.DEFAULT_TIMEOUT_SEC;

    @CommandLine.Option(names = {"-s", "--scale"}, defaultValue = "1000",
        paramLabel = "<scale>", description = "Minimum factor turning weights into integers (default: ${DEFAULT-VALUE})")
    private double weightScale = ExtractionSettings.DEFAULT_WEIGHT_SCALE;

    @CommandLine.Option(names = {"--sequential"}, description = "Build the constraints on a single thread")
    private boolean sequential = false;

    @CommandLine.Option(names = {"-m", "--model"}, paramLabel = "<file>", description = "Write the model as JSON")
    private Path modelFile;

    @CommandLine.Option(names = {"-w", "--wcnf"}, paramLabel = "<file>", description = "Write the weighted CNF problem")
    private Path wcnfFile;

    @CommandLine.Option(names = {"-e", "--encode-only"}, description = "Stop after encoding the constraints")
    private boolean encodeOnly = false;

    @Override
    public Integer call() {
        try {
            ExtractionSettings settings = new ExtractionSettings(this.occurrenceThreshold, this.timeoutSec,
                this.weightScale, !this.sequential);
            ObservationLists observations = new ObservationReader().read(this.observationFile);
            Amdn amdn = new Amdn(settings);
            EncodedProblem problem = amdn.encode(observations);
            if (this.wcnfFile != null) {
                new WcnfWriter().write(problem.getCnf(), problem.getDecodeTable().names(), this.wcnfFile);
                LOGGER.info("Weighted CNF written to {}", this.wcnfFile);
            }
            if (this.encodeOnly) {
                return 0;
            }
            Model model = amdn.solve(problem, observations);
            System.out.println(model.details());
            if (this.modelFile != null) {
                new ModelSerializer().serialize(model, this.modelFile);
                LOGGER.info("Model written to {}", this.modelFile);
            }
            return 0;
        } catch (IOException e) {
            LOGGER.error("I/O error: {}", e.getMessage(), e);
            return 1;
        } catch (ExtractionException | IllegalArgumentException e) {
            LOGGER.error("Extraction failed: {}", e.getMessage());
            return 1;
        }
    }

    public static void main(String[] args) {
        try {
            CommandLine cmd = new CommandLine(new AmdnCommand());
            int exitCode = cmd.execute(args);
            System.exit(exitCode);
        } catch (Throwable t) {
            System.err.println("FATAL ERROR: " + t.getMessage());
            t.printStackTrace(System.err);
            System.exit(1);
        }
    }
}
