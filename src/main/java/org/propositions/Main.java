package org.propositions;

import org.propositions.operators.OperatorBasis;
import org.propositions.proofs.InferenceRule;
import org.propositions.semantics.Model;
import org.propositions.semantics.Semantics;
import org.propositions.semantics.Synthesizer;
import org.propositions.syntax.Formula;
import org.propositions.syntax.FormulaParser;
import org.propositions.syntax.ParseResult;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MOTORE PROPOSIZIONALE - Interfaccia da linea di comando
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula singola (-e) o file con una formula per riga (-f)
 * 2. PARSING: notazione standard o polacca (-polish) tramite grammatiche ANTLR
 * 3. SEMANTICA: tabella di verità e classificazione (tautologia, contraddizione, soddisfacibile)
 * 4. RIDUZIONI: riscrittura sulle basi di operatori richieste (-opt=...), con verifica di equivalenza
 * 5. OUTPUT: report testuale su console
 *
 * MODALITÀ AGGIUNTIVE:
 * - Sintesi (-synth=dnf|cnf): formula da tabella di verità
 * - Regola (-rule): verifica della correttezza di una regola di inferenza
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String POLISH_PARAM = "-polish";
    private static final String OPT_PARAM = "-opt=";
    private static final String SYNTH_PARAM = "-synth=";
    private static final String RULE_PARAM = "-rule";

    /**
     * Flag disponibili
     * */
    private static final String OPT_ALL = "all";
    private static final String SYNTH_DNF = "dnf";
    private static final String SYNTH_CNF = "cnf";

    /** Separatore per liste di variabili e di assunzioni */
    private static final String LIST_SEPARATOR = ",";

    /** Prefisso dei commenti nei file di formule */
    private static final String COMMENT_PREFIX = "#";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        int exitCode = run(args, System.out);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'applicazione scrivendo il report sullo stream indicato.
     *
     * @param args parametri linea di comando
     * @param out destinazione dell'output
     * @return codice di uscita: 0 se l'esecuzione è andata a buon fine, 1 altrimenti
     */
    static int run(String[] args, PrintStream out) {
        out.println("---> AVVIO MOTORE PROPOSIZIONALE <---");

        try {
            if (args.length == 0) {
                out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return 1;
            }

            EngineConfiguration config;
            try {
                config = new ArgumentParser().parse(args);
            } catch (IllegalArgumentException e) {
                out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
                out.println("Usa -h per visualizzare l'help completo.");
                return 1;
            }

            if (config == null) {
                printApplicationHelp(out);
                return 0;
            }

            executeMainPipeline(config, out);
            return 0;

        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
            out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            out.println("Controllare i log per dettagli completi.");
            return 1;
        } finally {
            out.println("---> FINE ESECUZIONE MOTORE PROPOSIZIONALE <---");
        }
    }

    /**
     * Determina la modalità operativa e delega all'handler appropriato.
     */
    private static void executeMainPipeline(EngineConfiguration config, PrintStream out) throws IOException {
        switch (config.mode) {
            case SYNTHESIS -> {
                out.println("[I] Modalità: Sintesi " + config.synthesisForm.toUpperCase());
                processSynthesis(config, out);
            }
            case RULE -> {
                out.println("[I] Modalità: Verifica regola di inferenza");
                processInferenceRule(config, out);
            }
            case FILE -> {
                out.println("[I] Modalità: Elaborazione file " + config.inputPath);
                processFormulaFile(config, out);
            }
            case EXPRESSION -> {
                out.println("[I] Modalità: Formula singola");
                processFormulaText(config.expression, config, out);
            }
        }
    }

    //endregion

    //region ELABORAZIONE FORMULE

    /**
     * Elabora tutte le formule di un file, una per riga, saltando righe vuote e commenti.
     */
    private static void processFormulaFile(EngineConfiguration config, PrintStream out) throws IOException {
        List<String> lines = Files.readAllLines(Paths.get(config.inputPath));

        int processed = 0;
        int rejected = 0;
        for (String line : lines) {
            String text = line.trim();
            if (text.isEmpty() || text.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            if (processFormulaText(text, config, out)) {
                processed++;
            } else {
                rejected++;
            }
        }

        out.println("[I] Formule elaborate: " + processed + ", rifiutate: " + rejected);
    }

    /**
     * Legge ed elabora una formula testuale.
     *
     * @return true se la formula è valida ed è stata elaborata
     */
    private static boolean processFormulaText(String text, EngineConfiguration config, PrintStream out) {
        ParseResult result = config.polishInput
                ? FormulaParser.parsePolish(text)
                : FormulaParser.parseStandard(text);

        if (!result.isSuccess()) {
            LOGGER.warning("Formula rifiutata: " + text);
            out.println("[W] Formula non valida '" + text + "': " + result.getErrorMessage());
            return false;
        }

        Formula formula = result.getFormula();
        if (formula.variables().size() > Semantics.MAX_ENUMERATED_VARIABLES) {
            LOGGER.warning("Formula rifiutata per numero di variabili: " + text);
            out.println("[W] Formula troppo grande '" + text + "': " + formula.variables().size()
                    + " variabili, massimo " + Semantics.MAX_ENUMERATED_VARIABLES);
            return false;
        }

        printFormulaReport(formula, config.reductions, out);
        return true;
    }

    /**
     * Stampa forme testuali, tabella di verità, classificazione e riduzioni richieste.
     */
    private static void printFormulaReport(Formula formula, Set<OperatorBasis> reductions, PrintStream out) {
        out.println("\n-->> FORMULA " + formula + " <<--");
        out.println("Notazione polacca: " + formula.toPolish());
        out.println("Variabili: " + formula.variables());
        out.println("Operatori: " + formula.operators());
        out.println();
        out.print(Semantics.truthTable(formula));
        out.println();
        out.println("Tautologia: " + yesNo(Semantics.isTautology(formula)));
        out.println("Contraddizione: " + yesNo(Semantics.isContradiction(formula)));
        out.println("Soddisfacibile: " + yesNo(Semantics.isSatisfiable(formula)));

        for (OperatorBasis basis : reductions) {
            Formula reduced = basis.reduce(formula);
            out.println("Base " + basis + ": " + reduced
                    + " (equivalente: " + yesNo(isEquivalent(formula, reduced)) + ")");
        }
    }

    /**
     * Confronta le tabelle di verità sull'unione delle variabili delle due formule.
     */
    private static boolean isEquivalent(Formula original, Formula reduced) {
        Set<String> union = new HashSet<>(original.variables());
        union.addAll(reduced.variables());
        List<String> variables = new ArrayList<>(union);
        variables.sort(null);

        for (Model model : Semantics.allModels(variables)) {
            if (Semantics.evaluate(original, model) != Semantics.evaluate(reduced, model)) {
                return false;
            }
        }
        return true;
    }

    //endregion

    //region SINTESI E REGOLE

    private static void processSynthesis(EngineConfiguration config, PrintStream out) {
        Formula synthesized = SYNTH_CNF.equals(config.synthesisForm)
                ? Synthesizer.synthesizeCnf(config.synthesisVariables, config.synthesisValues)
                : Synthesizer.synthesize(config.synthesisVariables, config.synthesisValues);

        out.println("Formula sintetizzata: " + synthesized);
        out.println();
        out.print(Semantics.truthTable(synthesized));
    }

    private static void processInferenceRule(EngineConfiguration config, PrintStream out) {
        InferenceRule rule = config.rule;
        out.println("Regola: " + rule);
        if (rule.variables().size() > Semantics.MAX_ENUMERATED_VARIABLES) {
            LOGGER.warning("Regola rifiutata per numero di variabili: " + rule);
            out.println("[W] Regola troppo grande: " + rule.variables().size()
                    + " variabili, massimo " + Semantics.MAX_ENUMERATED_VARIABLES);
            return;
        }
        out.println("Corretta: " + yesNo(Semantics.isSoundInference(rule)));
    }

    private static String yesNo(boolean value) {
        return value ? "sì" : "no";
    }

    //endregion

    //region HELP

    private static void printApplicationHelp(PrintStream out) {
        out.println("""

                USO: java -jar motore-proposizionale.jar [opzioni]

                INPUT:
                  -e <formula>          Elabora una singola formula
                  -f <file>             Elabora un file con una formula per riga (# per i commenti)
                  -polish               Le formule in input sono in notazione polacca

                RIDUZIONI:
                  -opt=<basi>           Basi separate da virgola: nao, na, nand, nor, in, if oppure all
                                        nao={~,&,|} na={~,&} nand={-&} nor={-|} in={->,~} if={->,F}

                ALTRE MODALITÀ:
                  -synth=<dnf|cnf> <variabili> <valori>
                                        Sintesi da tabella di verità (es. -synth=dnf p,q TTTF)
                  -rule <assunzioni> <conclusione>
                                        Verifica di una regola (es. -rule p,(p->q) q)

                  -h                    Mostra questo help

                NOTAZIONE STANDARD: variabili p..z con cifre opzionali, costanti T F,
                ~A e (A op B) con op tra & | -> + <-> -& -|, senza spazi.
                """);
    }

    //endregion

    //region CLASSI DI SUPPORTO

    private enum Mode { EXPRESSION, FILE, SYNTHESIS, RULE }

    /**
     * Configurazione immutabile risultante dall'analisi dei parametri.
     */
    private static final class EngineConfiguration {
        final Mode mode;
        final String expression;
        final String inputPath;
        final boolean polishInput;
        final Set<OperatorBasis> reductions;
        final String synthesisForm;
        final List<String> synthesisVariables;
        final List<Boolean> synthesisValues;
        final InferenceRule rule;

        EngineConfiguration(Mode mode, String expression, String inputPath, boolean polishInput,
                            Set<OperatorBasis> reductions, String synthesisForm, List<String> synthesisVariables,
                            List<Boolean> synthesisValues, InferenceRule rule) {
            this.mode = mode;
            this.expression = expression;
            this.inputPath = inputPath;
            this.polishInput = polishInput;
            this.reductions = reductions;
            this.synthesisForm = synthesisForm;
            this.synthesisVariables = synthesisVariables;
            this.synthesisValues = synthesisValues;
            this.rule = rule;
        }
    }

    /**
     * Analizzatore dei parametri della linea di comando.
     */
    private static final class ArgumentParser {

        /**
         * Processa sequenzialmente tutti i parametri e costruisce la configurazione.
         *
         * @param args parametri da linea comando
         * @return configurazione validata, oppure null se è stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        EngineConfiguration parse(String[] args) {
            Mode mode = null;
            String expression = null;
            String inputPath = null;
            boolean polishInput = false;
            Set<OperatorBasis> reductions = EnumSet.noneOf(OperatorBasis.class);
            String synthesisForm = null;
            List<String> synthesisVariables = null;
            List<Boolean> synthesisValues = null;
            InferenceRule rule = null;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        return null;
                    }

                    case EXPRESSION_PARAM -> {
                        validateExclusiveMode(mode, Mode.EXPRESSION);
                        expression = getNextArgument(args, ++i, "formula");
                        mode = Mode.EXPRESSION;
                    }

                    case FILE_PARAM -> {
                        validateExclusiveMode(mode, Mode.FILE);
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        mode = Mode.FILE;
                    }

                    case POLISH_PARAM -> polishInput = true;

                    case RULE_PARAM -> {
                        validateExclusiveMode(mode, Mode.RULE);
                        String assumptions = getNextArgument(args, ++i, "assunzioni");
                        String conclusion = getNextArgument(args, ++i, "conclusione");
                        rule = parseRule(assumptions, conclusion);
                        mode = Mode.RULE;
                    }

                    default -> {
                        if (args[i].startsWith(OPT_PARAM)) {
                            reductions = parseReductionFlags(args[i].substring(OPT_PARAM.length()));
                        } else if (args[i].startsWith(SYNTH_PARAM)) {
                            validateExclusiveMode(mode, Mode.SYNTHESIS);
                            synthesisForm = args[i].substring(SYNTH_PARAM.length());
                            if (!SYNTH_DNF.equals(synthesisForm) && !SYNTH_CNF.equals(synthesisForm)) {
                                throw new IllegalArgumentException("Forma di sintesi non supportata: " + synthesisForm
                                        + ". Supportate: " + SYNTH_DNF + ", " + SYNTH_CNF);
                            }
                            synthesisVariables = parseVariables(getNextArgument(args, ++i, "variabili"));
                            if (synthesisVariables.size() > Semantics.MAX_ENUMERATED_VARIABLES) {
                                throw new IllegalArgumentException("Troppe variabili per la sintesi: "
                                        + synthesisVariables.size() + ", massimo " + Semantics.MAX_ENUMERATED_VARIABLES);
                            }
                            synthesisValues = parseValues(getNextArgument(args, ++i, "valori"));
                            if (synthesisValues.size() != 1 << synthesisVariables.size()) {
                                throw new IllegalArgumentException("Attesi " + (1 << synthesisVariables.size())
                                        + " valori di verità, ricevuti " + synthesisValues.size());
                            }
                            mode = Mode.SYNTHESIS;
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (mode == null) {
                throw new IllegalArgumentException("Specificare una formula (-e), un file (-f), una sintesi (-synth) o una regola (-rule)");
            }

            return new EngineConfiguration(mode, expression, inputPath, polishInput, reductions,
                    synthesisForm, synthesisVariables, synthesisValues, rule);
        }

        private void validateExclusiveMode(Mode current, Mode requested) {
            if (current != null) {
                throw new IllegalArgumentException("Modalità " + requested + " non può essere combinata con " + current);
            }
        }

        private String getNextArgument(String[] args, int index, String argumentType) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[index - 1] + " richiede " + argumentType);
            }
            return args[index];
        }

        private void validateFileExists(String path) {
            Path file = Paths.get(path);
            if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
                throw new IllegalArgumentException("File non esistente o non leggibile: " + path);
            }
        }

        private Set<OperatorBasis> parseReductionFlags(String value) {
            Set<OperatorBasis> reductions = EnumSet.noneOf(OperatorBasis.class);
            if (OPT_ALL.equals(value)) {
                return EnumSet.allOf(OperatorBasis.class);
            }
            for (String flag : value.split(LIST_SEPARATOR)) {
                reductions.add(OperatorBasis.fromFlag(flag.trim()));
            }
            return reductions;
        }

        private List<String> parseVariables(String value) {
            List<String> variables = new ArrayList<>();
            for (String name : value.split(LIST_SEPARATOR)) {
                String variable = name.trim();
                if (!Formula.isVariable(variable)) {
                    throw new IllegalArgumentException("Nome di variabile non valido: " + variable);
                }
                variables.add(variable);
            }
            return variables;
        }

        /**
         * Converte una sequenza di T/F nei valori di verità corrispondenti.
         */
        private List<Boolean> parseValues(String value) {
            List<Boolean> values = new ArrayList<>();
            for (char c : value.toCharArray()) {
                switch (c) {
                    case 'T' -> values.add(true);
                    case 'F' -> values.add(false);
                    default -> throw new IllegalArgumentException("Valore di verità non valido: " + c);
                }
            }
            return values;
        }

        private InferenceRule parseRule(String assumptions, String conclusion) {
            List<Formula> parsedAssumptions = new ArrayList<>();
            if (!assumptions.isBlank()) {
                for (String text : assumptions.split(LIST_SEPARATOR)) {
                    parsedAssumptions.add(parseArgumentFormula(text.trim()));
                }
            }
            return new InferenceRule(parsedAssumptions, parseArgumentFormula(conclusion));
        }

        private Formula parseArgumentFormula(String text) {
            ParseResult result = FormulaParser.parseStandard(text);
            if (!result.isSuccess()) {
                throw new IllegalArgumentException("Formula non valida '" + text + "': " + result.getErrorMessage());
            }
            return result.getFormula();
        }
    }

    //endregion
}
