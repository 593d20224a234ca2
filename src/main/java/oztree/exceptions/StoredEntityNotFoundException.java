package oztree.exceptions;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import org.apache.commons.lang3.StringUtils;

/**
 * Base class for exceptions raised when an entity that was expected to be registered is not found.
 */
public class StoredEntityNotFoundException extends Exception {

    private static final long serialVersionUID = 1L;
    private String singularEntity;
    private String pluralEntity;
    private ArrayList<String> missingNames;
    private String sourceFile;

    // single name constructor
    public StoredEntityNotFoundException(String name, String singularEntityName, String pluralEntityName){
        this.singularEntity = singularEntityName;
        this.pluralEntity = pluralEntityName;
        this.missingNames = new ArrayList<String>();
        this.missingNames.add(name);
    }

    // list of names constructor
    public StoredEntityNotFoundException(List<String> names, String singularEntityName, String pluralEntityName){
        this.singularEntity = singularEntityName;
        this.pluralEntity = pluralEntityName;
        this.missingNames = new ArrayList<String>();
        this.missingNames.addAll(names);
    }

    public List<String> getMissingNames() {
        return this.missingNames;
    }

    /** @return the tree file the names were read from, or null if unknown */
    public String getSourceFile() {
        return this.sourceFile;
    }

    public void setSourceFile(String sourceFile) {
        this.sourceFile = sourceFile;
    }

    private String getNames(){
        return StringUtils.join(this.missingNames, ", ");
    }

    public String getQuotedName(){
        return "\'" + this.getNames() + "\'";
    }

    @Override
    public String getMessage() {
        return this.toString();
    }

    @Override
    public String toString(){
        String where = this.sourceFile == null ? "" : " (in " + this.sourceFile + ")";
        return this.singularEntity + " \"" + this.getNames() + "\" is not recognized" + where + ".";
    }

    public void reportFailedAction(PrintStream out, String failedAction) {
        String qn = this.getQuotedName();
        String noun = (missingNames.size() == 1 ? this.singularEntity : this.pluralEntity);
        String pre = failedAction + " failed; " + noun + " not recognized: ";
        out.println(pre + qn + (this.sourceFile == null ? "" : " in " + this.sourceFile));
    }
}
