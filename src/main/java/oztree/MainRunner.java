package oztree;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.apache.commons.io.FileUtils;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import oztree.build.TreeAssembler;
import oztree.constants.GeneralConstants;
import oztree.dating.DateImputer;
import oztree.dating.NodeAges;
import oztree.dating.UltrametricityChecker;
import oztree.dating.UltrametricityFixer;
import oztree.exceptions.DataFormatException;
import oztree.exceptions.NewickSyntaxException;
import oztree.exceptions.StoredEntityNotFoundException;
import oztree.exceptions.TokenNotFoundException;
import oztree.exceptions.TreeAssemblyException;
import oztree.exceptions.TreeDatingException;
import oztree.exceptions.UltrametricToleranceException;
import oztree.extract.MinimalTreeExtractor;
import oztree.extract.OpenTreePartsExtractor;
import oztree.extract.SubtreeExtractor;
import oztree.newick.NewickFormatter;
import oztree.tokens.TokenDecoder;
import oztree.tokens.TokenMapping;
import oztree.tree.Tree;
import oztree.tree.TreeReader;

public class MainRunner {
    static Logger _LOG = Logger.getLogger(MainRunner.class);

    /*
     * Build the complete OneZoom tree from the base file, the fragments next to it and the
     * extracted Open Tree parts.
     */
    /// @returns 0 for success, 1 for poorly formed command
    public int buildTree(String [] args) throws TreeAssemblyException, TokenNotFoundException, DataFormatException, IOException {
        boolean printFileTree = false;
        String mappingFile = null;
        List<String> positional = new ArrayList<String>();
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--printfiletree")) {
                printFileTree = true;
            } else if (args[i].equals("--mapping") && i + 1 < args.length) {
                mappingFile = args[++i];
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.size() < 2 || positional.size() > 3) {
            System.out.println("arguments should be: [--printfiletree] [--mapping file.json] base_tree_file ot_parts_folder [outfile]");
            return 1;
        }
        File baseFile = new File(positional.get(0));
        File otPartsFolder = new File(positional.get(1));
        String outFile = positional.size() == 3 ? positional.get(2) : null;

        TreeAssembler assembler = new TreeAssembler(new TokenDecoder(loadMapping(mappingFile)));
        if (printFileTree) {
            assembler.setFileTreeLogger(new MessageLogger(""));
        }
        // the fragments live next to the base file
        String tree = assembler.build(baseFile, baseFile.getAbsoluteFile().getParentFile(), otPartsFolder);
        writeOutput(outFile, tree);
        return 0;
    }

    /*
     * Extract the Open Tree subtrees named in a set of OneZoom files, one file per ott.
     */
    public int extractOpenTreeParts(String [] args) throws TokenNotFoundException, DataFormatException, IOException {
        String mappingFile = null;
        List<String> positional = new ArrayList<String>();
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--mapping") && i + 1 < args.length) {
                mappingFile = args[++i];
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.size() < 3) {
            System.out.println("arguments should be: [--mapping file.json] open_tree_file output_dir onezoom_file [onezoom_file ...]");
            return 1;
        }
        OpenTreePartsExtractor extractor = new OpenTreePartsExtractor(new TokenDecoder(loadMapping(mappingFile)));
        for (String f : positional.subList(2, positional.size())) {
            extractor.addFragmentFile(new File(f));
        }
        extractor.writeParts(new File(positional.get(0)), new File(positional.get(1)));
        return 0;
    }

    /*
     * Extract one or more subtrees, optionally leaving out some of their descendants.
     */
    public int extractSubtrees(String [] args) throws IOException {
        Set<String> taxa = new HashSet<String>();
        Set<String> excluded = new HashSet<String>();
        int ancestors = 0;
        List<String> positional = new ArrayList<String>();
        Set<String> collecting = null;
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("-t") || args[i].equals("--taxa")) {
                collecting = taxa;
            } else if (args[i].equals("-x") || args[i].equals("--excluded_taxa")) {
                collecting = excluded;
            } else if ((args[i].equals("-a") || args[i].equals("--include_ancestors")) && i + 1 < args.length) {
                ancestors = Integer.parseInt(args[++i]);
                collecting = null;
            } else if (collecting != null) {
                collecting.add(args[i]);
            } else {
                positional.add(args[i]);
            }
        }
        if (taxa.isEmpty() || positional.size() < 1 || positional.size() > 2) {
            System.out.println("arguments should be: treefile [outfile] -t taxon [taxon ...] [-x taxon ...] [-a ancestor_count]");
            return 1;
        }
        String tree = GeneralUtils.readTrimmedTree(new File(positional.get(0)));
        Map<String, String> subtrees = SubtreeExtractor.extract(tree, taxa, excluded, ancestors);

        StringBuilder sb = new StringBuilder();
        if (subtrees.size() == 1) {
            sb.append(subtrees.values().iterator().next()).append(";\n");
        } else {
            for (Map.Entry<String, String> e : subtrees.entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append(";\n");
            }
        }
        writeOutput(positional.size() == 2 ? positional.get(1) : null, sb.toString());
        return 0;
    }

    /*
     * Extract the smallest tree that connects a set of taxa.
     */
    public int extractMinimalTree(String [] args) throws IOException {
        Set<String> taxa = new HashSet<String>();
        List<String> positional = new ArrayList<String>();
        boolean collecting = false;
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("-t") || args[i].equals("--taxa")) {
                collecting = true;
            } else if (collecting) {
                taxa.add(args[i]);
            } else {
                positional.add(args[i]);
            }
        }
        if (taxa.isEmpty() || positional.size() < 1 || positional.size() > 2) {
            System.out.println("arguments should be: treefile [outfile] -t taxon [taxon ...]");
            return 1;
        }
        String tree = GeneralUtils.readTrimmedTree(new File(positional.get(0)));
        String result = MinimalTreeExtractor.extract(tree, taxa);
        if (result != null) {
            writeOutput(positional.size() == 2 ? positional.get(1) : null, result + ";\n");
        }
        return 0;
    }

    /*
     * Pretty print a tree, one node per line.
     */
    public int formatNewick(String [] args) throws IOException {
        int indent = 2;
        List<String> positional = new ArrayList<String>();
        for (int i = 1; i < args.length; i++) {
            if ((args[i].equals("-i") || args[i].equals("--indent_spaces")) && i + 1 < args.length) {
                indent = Integer.parseInt(args[++i]);
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.size() < 1 || positional.size() > 2) {
            System.out.println("arguments should be: treefile [outfile] [-i indent_spaces]");
            return 1;
        }
        String tree = GeneralUtils.readTreeFile(new File(positional.get(0)));
        writeOutput(positional.size() == 2 ? positional.get(1) : null, new NewickFormatter(indent).format(tree));
        return 0;
    }

    /*
     * Report whether each tree is ultrametric.
     */
    public int checkUltrametricity(String [] args) throws IOException {
        boolean details = false;
        boolean strict = false;
        List<String> files = new ArrayList<String>();
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--details") || args[i].equals("--print_details")) {
                details = true;
            } else if (args[i].equals("--strict")) {
                strict = true;
            } else {
                files.add(args[i]);
            }
        }
        if (files.isEmpty()) {
            System.out.println("arguments should be: [--details] [--strict] newick_file [newick_file ...]");
            return 1;
        }
        UltrametricityChecker checker = new UltrametricityChecker();
        checker.setStrictEdgeLengths(strict);
        if (details) {
            checker.setDetailsLogger(new MessageLogger(""));
        }
        TreeReader reader = new TreeReader();
        for (String f : files) {
            File file = new File(f);
            System.out.println("====== " + file.getName());
            UltrametricityChecker.Result result = checker.check(reader.readTree(file));
            if (!result.isUltrametric()) {
                System.out.println(result.getMessage());
            }
        }
        return 0;
    }

    /*
     * Adjust the leaf edges so every leaf is at the expected age.
     */
    public int fixUltrametricity(String [] args) throws IOException, UltrametricToleranceException {
        if (args.length < 3 || args.length > 4) {
            System.out.println("arguments should be: treefile age [max_adjustment]");
            return 1;
        }
        double age = Double.parseDouble(args[2]);
        double maxAdjustment = args.length == 4 ? Double.parseDouble(args[3])
                : GeneralConstants.DEFAULT_MAX_ULTRAMETRIC_ADJUSTMENT.doubleValue();

        Tree tree = new TreeReader().readTree(new File(args[1]));
        new UltrametricityFixer(age, maxAdjustment).fix(tree);
        System.out.println(tree.getNewick(true, false));
        return 0;
    }

    /*
     * Date the nodes of an assembled tree and impute the missing dates.
     */
    public int dateTree(String [] args) throws IOException, DataFormatException, TreeDatingException {
        String nodeAgesFile = null;
        boolean branchLengths = false;
        List<String> positional = new ArrayList<String>();
        for (int i = 1; i < args.length; i++) {
            if (args[i].equals("--nodeages") && i + 1 < args.length) {
                nodeAgesFile = args[++i];
            } else if (args[i].equals("--branchlengths")) {
                branchLengths = true;
            } else {
                positional.add(args[i]);
            }
        }
        if (positional.size() < 1 || positional.size() > 2) {
            System.out.println("arguments should be: treefile [--nodeages node_ages.json] [--branchlengths] [outfile]");
            return 1;
        }
        Tree tree = new TreeReader().readTree(new File(positional.get(0)));
        if (nodeAgesFile != null) {
            NodeAges.apply(tree, NodeAges.load(new File(nodeAgesFile)));
        } else {
            NodeAges.fromBranchLengths(tree);
        }

        boolean dated = tree.getRoot().isDated();
        if (dated) {
            new DateImputer().dateTree(tree);
        } else {
            _LOG.warn("The root has no date, so no dates were imputed");
        }

        String out;
        if (branchLengths && dated) {
            DateImputer.computeBranchLengths(tree);
            out = tree.getNewick(true, false);
        } else {
            out = tree.getNewick(true, dated);
        }
        writeOutput(positional.size() == 2 ? positional.get(1) : null, out + "\n");
        return 0;
    }

    private static TokenMapping loadMapping(String mappingFile) throws IOException, DataFormatException {
        if (mappingFile == null) {
            return TokenMapping.loadDefault();
        }
        return TokenMapping.load(new File(mappingFile));
    }

    private static void writeOutput(String outFile, String text) throws IOException {
        if (outFile == null) {
            System.out.print(text);
            if (!text.endsWith("\n")) {
                System.out.println();
            }
        } else {
            FileUtils.writeStringToFile(new File(outFile), text, StandardCharsets.UTF_8);
            _LOG.info("Wrote " + outFile);
        }
    }

    /**
     * Removes the -v / -vv switches from the arguments, raising the log level accordingly.
     */
    static String [] applyVerbosity(String [] args) {
        int verbosity = 0;
        List<String> rest = new ArrayList<String>();
        for (String a : args) {
            if (a.equals("-v") || a.equals("--verbose")) {
                verbosity++;
            } else if (a.equals("-vv")) {
                verbosity += 2;
            } else {
                rest.add(a);
            }
        }
        if (verbosity == 1) {
            Logger.getRootLogger().setLevel(Level.INFO);
        } else if (verbosity >= 2) {
            Logger.getRootLogger().setLevel(Level.DEBUG);
        }
        return rest.toArray(new String[rest.size()]);
    }

    public static void printHelp() {
        System.out.println("==========================");
        System.out.println("usage: oztree is run as:");
        System.out.println("");
        System.out.println("build [--printfiletree] [--mapping file.json] base_tree_file ot_parts_folder [outfile]");
        System.out.println("extract [--mapping file.json] open_tree_file output_dir onezoom_file [onezoom_file ...]");
        System.out.println("extractsubtrees treefile [outfile] -t taxon [taxon ...] [-x taxon ...] [-a ancestor_count]");
        System.out.println("minimaltree treefile [outfile] -t taxon [taxon ...]");
        System.out.println("formatnewick treefile [outfile] [-i indent_spaces]");
        System.out.println("checkultrametric [--details] [--strict] newick_file [newick_file ...]");
        System.out.println("fixultrametric treefile age [max_adjustment]");
        System.out.println("datetree treefile [--nodeages node_ages.json] [--branchlengths] [outfile]");
        System.out.println("");
        System.out.println("add -v (info) or -vv (debug) to any command for more logging\n");
    }

    /**
     * @param args
     * @throws Exception 
     */
    public static void main(String[] args) throws Exception {
        args = applyVerbosity(args);
        if (args.length < 1) {
            printHelp();
            System.exit(1);
        }
        String command = args[0];
        if (command.compareTo("help") == 0 || args[0].equals("-h") || args[0].equals("--help")) {
            printHelp();
            System.exit(0);
        }
        int cmdReturnCode = 0;
        String action = "Command \"" + command + "\"";
        try {
            MainRunner mr = new MainRunner();

            if (command.compareTo("build") == 0) {
                cmdReturnCode = mr.buildTree(args);
            } else if (command.compareTo("extract") == 0) {
                cmdReturnCode = mr.extractOpenTreeParts(args);
            } else if (command.compareTo("extractsubtrees") == 0) {
                cmdReturnCode = mr.extractSubtrees(args);
            } else if (command.compareTo("minimaltree") == 0) {
                cmdReturnCode = mr.extractMinimalTree(args);
            } else if (command.compareTo("formatnewick") == 0) {
                cmdReturnCode = mr.formatNewick(args);
            } else if (command.compareTo("checkultrametric") == 0) {
                cmdReturnCode = mr.checkUltrametricity(args);
            } else if (command.compareTo("fixultrametric") == 0) {
                cmdReturnCode = mr.fixUltrametricity(args);
            } else if (command.compareTo("datetree") == 0) {
                cmdReturnCode = mr.dateTree(args);
            } else {
                System.err.println("Unrecognized command \"" + command + "\"");
                cmdReturnCode = 2;
            }
        } catch (StoredEntityNotFoundException tnfx) {
            tnfx.reportFailedAction(System.err, action);
            cmdReturnCode = -1;
        } catch (NewickSyntaxException nsx) {
            nsx.reportFailedAction(System.err, action);
            cmdReturnCode = -1;
        } catch (TreeAssemblyException tax) {
            tax.reportFailedAction(System.err, action);
            cmdReturnCode = -1;
        } catch (DataFormatException dfx) {
            dfx.reportFailedAction(System.err, action);
            cmdReturnCode = -1;
        } catch (UltrametricToleranceException utx) {
            utx.reportFailedAction(System.err, action);
            cmdReturnCode = -1;
        } catch (TreeDatingException tdx) {
            tdx.reportFailedAction(System.err, action);
            cmdReturnCode = -1;
        } catch (IOException ioe) {
            System.err.println(action + " failed. " + ioe);
            cmdReturnCode = -1;
        } catch (NumberFormatException nfe) {
            System.err.println(action + " failed. Expected a number: " + nfe.getMessage());
            cmdReturnCode = 1;
        }
        if (cmdReturnCode == 2) {
            printHelp();
        }
        System.exit(cmdReturnCode);
    }
}
