package pl.marcinmilkowski.proof_text;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.proof_text.filter.CaseMode;
import pl.marcinmilkowski.proof_text.vocab.VocabularyLoader;
import pl.marcinmilkowski.proof_text.vocab.WordTable;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Paths;

/**
 * Command-line entry point: generate proofing text from a vocabulary file.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    private static final String VOCABULARY_NAME = "cli";

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage(System.out);
            return;
        }

        try {
            run(args, System.out);
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
            System.exit(1);
        }
    }

    /**
     * Run one command, writing the generated text to the given stream.
     */
    static void run(String[] args, PrintStream out) throws IOException {
        String command = args[0].toLowerCase();
        if (command.equals("help")) {
            showUsage(out);
            return;
        }

        CommandLine cli = parseOptions(args);
        if (cli.vocabFile == null) {
            throw new IllegalArgumentException("--vocab is required");
        }
        WordTable table = cli.metaFile != null
            ? VocabularyLoader.load(Paths.get(cli.metaFile), Paths.get(cli.vocabFile))
            : VocabularyLoader.load(Paths.get(cli.vocabFile), cli.language, cli.bicameral);

        ProofTextGenerator generator = ProofTextGenerator.builder()
            .withVocabulary(VOCABULARY_NAME, table)
            .withRaiseErrors(cli.raiseErrors)
            .build();
        ProofOptions options = cli.options.build();

        switch (command) {
            case "word":
                out.println(generator.word(options));
                break;
            case "top-word":
                out.println(generator.topWord(options));
                break;
            case "top-words":
                out.println(String.join(" ", generator.topWords(options)));
                break;
            case "words":
                out.println(String.join(" ", generator.words(options)));
                break;
            case "number":
                out.println(generator.number(options));
                break;
            case "sentence":
                out.println(generator.sentence(options));
                break;
            case "paragraph":
                out.println(generator.paragraph(options));
                break;
            case "text":
                out.println(generator.text(options));
                break;
            default:
                throw new IllegalArgumentException("Unknown command: " + command);
        }
    }

    private static CommandLine parseOptions(String[] args) {
        CommandLine cli = new CommandLine();
        ProofOptions.Builder b = cli.options;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--vocab":
                case "-v":
                    cli.vocabFile = args[++i];
                    break;
                case "--meta":
                    cli.metaFile = args[++i];
                    break;
                case "--lang":
                case "-l":
                    cli.language = args[++i];
                    break;
                case "--unicameral":
                    cli.bicameral = false;
                    break;
                case "--raise-errors":
                    cli.raiseErrors = true;
                    break;
                case "--glyphs":
                case "-g":
                    b.withGlyphs(args[++i]);
                    break;
                case "--case":
                    b.withCase(CaseMode.parse(args[++i]));
                    break;
                case "--seed":
                    b.withSeed(args[++i]);
                    break;
                case "--randomness":
                    b.withRandomness(Double.parseDouble(args[++i]));
                    break;
                case "--top-k":
                    b.withTopK(Integer.parseInt(args[++i]));
                    break;
                case "--index":
                    b.withIndex(Integer.parseInt(args[++i]));
                    break;
                case "--min-length":
                    b.withMinLength(Integer.parseInt(args[++i]));
                    break;
                case "--max-length":
                    b.withMaxLength(Integer.parseInt(args[++i]));
                    break;
                case "--length":
                    b.withExactLength(Integer.parseInt(args[++i]));
                    break;
                case "--starts-with":
                    b.withStartsWith(args[++i]);
                    break;
                case "--ends-with":
                    b.withEndsWith(args[++i]);
                    break;
                case "--contains":
                    b.withContains(args[++i]);
                    break;
                case "--inner":
                    b.withInner(args[++i]);
                    break;
                case "--regex":
                    b.withRegex(args[++i]);
                    break;
                case "--num-words":
                case "-n":
                    b.withNumWords(Integer.parseInt(args[++i]));
                    break;
                case "--numbers":
                    b.withNumberProbability(Double.parseDouble(args[++i]));
                    break;
                case "--no-punctuation":
                    b.withPunctuation(false);
                    break;
                case "--punctuation-randomness":
                    b.withPunctuationRandomness(Double.parseDouble(args[++i]));
                    break;
                case "--num-sentences":
                    b.withNumSentences(Integer.parseInt(args[++i]));
                    break;
                case "--num-paragraphs":
                    b.withNumParagraphs(Integer.parseInt(args[++i]));
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }
        return cli;
    }

    private static final class CommandLine {
        private final ProofOptions.Builder options = ProofOptions.builder();
        private String vocabFile;
        private String metaFile;
        private String language = "en";
        private boolean bicameral = true;
        private boolean raiseErrors = false;
    }

    private static void showUsage(PrintStream out) {
        out.println("Usage: java -jar proof-text-lucene.jar <command> --vocab <file> [options]");
        out.println();
        out.println("Commands:");
        out.println("  word        One word sampled by frequency");
        out.println("  top-word    The most frequent word (or the one at --index)");
        out.println("  top-words   The most frequent words, --num-words of them");
        out.println("  words       A list of words");
        out.println("  number      A numeral from the available digits");
        out.println("  sentence    A punctuated sentence");
        out.println("  paragraph   Sentences joined by spaces");
        out.println("  text        Paragraphs joined by blank lines");
        out.println("  help        Show this message");
        out.println();
        out.println("Vocabulary:");
        out.println("  --vocab, -v <file>        Word list or word<TAB>count file");
        out.println("  --meta <file>             JSON metadata (lang, bicameral, punctuation)");
        out.println("  --lang, -l <code>         Language code without --meta (default: en)");
        out.println("  --unicameral              Script has no letter case");
        out.println();
        out.println("Filtering:");
        out.println("  --glyphs, -g <chars>      Available glyphs");
        out.println("  --case <mode>             any, any_og, lc, lc_force, cap, cap_og, cap_force, uc, uc_og, uc_force");
        out.println("  --min-length, --max-length, --length <n>");
        out.println("  --starts-with, --ends-with, --contains, --inner <text>");
        out.println("  --regex <pattern>");
        out.println();
        out.println("Sampling:");
        out.println("  --seed <text>             Seed for repeatable output");
        out.println("  --randomness <0..1>       0 follows frequency, 1 is uniform");
        out.println("  --top-k <n>               Only the n most frequent words");
        out.println("  --index <n>               Position for top-word(s)");
        out.println("  --num-words, -n <n>       --numbers <0..1>  --num-sentences <n>  --num-paragraphs <n>");
        out.println("  --no-punctuation          --punctuation-randomness <0..1>");
        out.println("  --raise-errors            Fail instead of returning empty text");
    }
}
