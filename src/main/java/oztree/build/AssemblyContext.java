package oztree.build;

import java.io.File;
import oztree.MessageLogger;
import oztree.tokens.TokenDecoder;

/**
 * State shared by the recursive calls of one assembly run: where to find the files, how to decode
 *	tokens, where the output goes and how deep the current inclusion is.
 */
class AssemblyContext {

	final File fragmentsFolder;
	final File referencePartsFolder;
	final TokenDecoder decoder;
	final Appendable out;

	// non-null when the inclusion file tree is being reported
	final MessageLogger fileTreeLogger;

	int depth = 0;

	AssemblyContext(File fragmentsFolder, File referencePartsFolder, TokenDecoder decoder, Appendable out,
			MessageLogger fileTreeLogger) {
		this.fragmentsFolder = fragmentsFolder;
		this.referencePartsFolder = referencePartsFolder;
		this.decoder = decoder;
		this.out = out;
		this.fileTreeLogger = fileTreeLogger;
	}
}
