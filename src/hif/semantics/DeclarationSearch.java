package hif.semantics;

import hif.model.Call;
import hif.model.Contents;
import hif.model.Declaration;
import hif.model.DesignUnit;
import hif.model.Entity;
import hif.model.EnumType;
import hif.model.EnumValue;
import hif.model.FieldReference;
import hif.model.Identifier;
import hif.model.Instance;
import hif.model.Library;
import hif.model.LibraryDef;
import hif.model.Node;
import hif.model.NodeList;
import hif.model.ParameterAssign;
import hif.model.PortAssign;
import hif.model.RecordType;
import hif.model.ReferencedAssign;
import hif.model.StateTable;
import hif.model.SubProgram;
import hif.model.Symbol;
import hif.model.SystemRoot;
import hif.model.TPAssign;
import hif.model.Type;
import hif.model.TypeDef;
import hif.model.TypeReference;
import hif.model.View;
import hif.model.ViewReference;
import hif.util.Trees;
import java.util.ArrayList;
import java.util.List;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Collects the declarations a symbol may denote, walking outward from its position.
 * <p>
 * Each scope on the way contributes its lists in a fixed order (declarations, state tables, ports,
 * generic parameters, imported libraries). Inside the list holding the node the walk comes from,
 * only the entries before that node are visible, unless the symbol is a call, a view reference or a
 * library. Non-overloadable lookups stop at the first scope that yields a declaration; calls collect
 * every visible candidate up to the root.
 * </p>
 * One instance serves a single lookup.
 */
class DeclarationSearch {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  /** Declarations found by a search, plus whether their absence is acceptable. */
  record Result(List<Declaration> declarations, boolean allowNotFound) {}

  private final Symbol symbol;
  private final Node start;
  private final String index;
  private final LanguageSemantics sem;
  private final DeclarationOptions opt;
  private final boolean overloadable;
  private final boolean searchAll;

  private final List<Declaration> results = new ArrayList<>();
  private Node location;
  private Node previous = null;
  private boolean isInLibrary = false;
  private boolean checkOnlyClasses = false;
  private boolean checkOnlyStandardLibraryDefs = false;
  private boolean allowNotFound = false;

  DeclarationSearch(Symbol symbol, LanguageSemantics sem, DeclarationOptions opt) {
    this.symbol = symbol;
    this.start = (Node)symbol;
    this.index = symbol.getName();
    this.sem = sem;
    this.opt = opt;
    this.overloadable = symbol instanceof Call;
    this.searchAll = symbol instanceof Call || symbol instanceof ViewReference || symbol instanceof Library;
    this.location = opt.location != null ? opt.location : start;
  }

  Result run() {
    if (isPrefixed(start))
      manage();
    else
      dispatch(location);

    if (keepSearching() && searchesImplicitLibraries(start) && !checkOnlyClasses) {
      // declarations visible without an import
      for (LibraryDef lib : sem.getImplicitLibraries())
        searchLibraryDef(lib);
    }
    if (start instanceof Library && results.isEmpty()) {
      LibraryDef std = sem.getStandardLibrary(index);
      if (std != null)
        results.add(std);
    }
    logger.trace("Search of '{}' ({}) found {} declaration(s)", index, start.getKind(), results.size());
    return new Result(results, allowNotFound);
  }

  private static boolean isPrefixed(Node n) {
    return !(n instanceof Identifier);
  }

  private static boolean searchesImplicitLibraries(Node n) {
    return n instanceof Identifier || n instanceof Call || n instanceof TypeReference;
  }

  private boolean keepSearching() {
    return overloadable || results.isEmpty();
  }

  //// Walk ////

  private void dispatch(Node n) {
    switch (n.getKind()) {
    case CONTENTS: {
      Contents c = (Contents)n;
      searchList(c.declarations);
      searchList(c.stateTables);
      if (checkOnlyClasses)
        return;
      searchLibraries(c.libraries);
      if (keepSearching())
        mapParent(n);
      break;
    }
    case DESIGN_UNIT:
      searchList(((DesignUnit)n).views);
      if (keepSearching())
        mapParent(n);
      break;
    case ENTITY:
      searchList(((Entity)n).ports);
      if (keepSearching())
        mapParent(n);
      break;
    case LIBRARY_DEF: {
      LibraryDef ld = (LibraryDef)n;
      searchList(ld.declarations);
      if (isInLibrary)
        return;
      if (keepSearching())
        searchLibraries(ld.libraries);
      if (keepSearching())
        mapParent(n);
      break;
    }
    case RECORD:
      searchList(((RecordType)n).fields);
      if (keepSearching())
        mapParent(n);
      break;
    case STATE_TABLE:
      searchList(((StateTable)n).declarations);
      if (keepSearching())
        mapParent(n);
      break;
    case FUNCTION:
    case PROCEDURE: {
      SubProgram sub = (SubProgram)n;
      searchList(sub.parameters);
      searchList(sub.templateParameters);
      if (!overloadable && !results.isEmpty())
        return;
      checkDeclaration(sub);
      if (keepSearching())
        mapParent(n);
      break;
    }
    case SYSTEM: {
      SystemRoot sys = (SystemRoot)n;
      searchList(sys.designUnits);
      searchList(sys.libraryDefs);
      searchList(sys.declarations);
      searchLibraries(sys.libraries);
      break;
    }
    case TYPE_DEF:
      searchList(((TypeDef)n).templateParameters);
      if (keepSearching())
        mapParent(n);
      break;
    case VIEW: {
      View view = (View)n;
      searchList(view.declarations);
      searchEntity(view.getEntity());
      searchList(view.templateParameters);
      if (checkOnlyClasses)
        return;
      searchLibraries(view.libraries);
      if (keepSearching())
        mapParent(n);
      break;
    }
    default:
      mapParent(n);
      break;
    }
  }

  private void mapParent(Node n) {
    if (n.getParent() == null)
      return;
    previous = n;
    dispatch(n.getParent());
  }

  /** Starts the walk above a prefixed symbol, or from the requested location. */
  private void searchInParent(Node n) {
    if (n == location && n == start) {
      mapParent(location);
    } else if (Trees.isSubNode(location, n, false)) {
      mapParent(n);
    } else {
      previous = n;
      dispatch(location);
    }
  }

  //// Lists ////

  private void searchList(NodeList<? extends Declaration> list) {
    if (checkOnlyStandardLibraryDefs) {
      if (!(list.getOwner() instanceof LibraryDef) || !((LibraryDef)list.getOwner()).isStandard())
        return;
    }
    if (!overloadable && !results.isEmpty())
      return;

    int pos = (previous != null && previous.getOwnerList() == list) ? list.indexOf(previous) : -1;
    if (!searchAll && pos >= 0) {
      // only the declarations before the one we come from
      for (int i = pos - 1; i >= 0; --i)
        checkDeclaration(list.get(i));
    } else {
      for (Declaration d : list)
        checkDeclaration(d);
    }
  }

  private void searchEntity(Entity entity) {
    if (entity == null)
      return;
    if (!overloadable && !results.isEmpty())
      return;
    if (previous instanceof Entity)
      return;
    for (Declaration port : entity.ports)
      checkDeclaration(port);
  }

  private void searchLibraries(NodeList<Library> libraries) {
    if (!overloadable && !results.isEmpty())
      return;
    // imports are never searched for library names, avoiding mutual recursion between imports
    if (checkOnlyClasses || start instanceof Library)
      return;
    for (Library lib : libraries) {
      if (lib.getName().equals(index))
        continue;
      Node parent = lib.getParent();
      Node libLocation = parent.getParent() != null ? parent.getParent() : parent;
      DeclarationOptions dopt = new DeclarationOptions(opt);
      dopt.location = libLocation;
      dopt.forceRefresh = false;
      dopt.error = false;
      Declaration decl = DeclarationResolver.resolve(lib, sem, dopt);
      if (!(decl instanceof LibraryDef))
        continue;
      LibraryDef ld = (LibraryDef)decl;
      // a library imported from inside its own definition was already searched on the way up
      if (Trees.isSubNode(lib, ld, false))
        continue;
      searchLibraryDef(ld);
    }
  }

  private void searchLibraryDef(LibraryDef ld) {
    boolean restore = isInLibrary;
    isInLibrary = true;
    dispatch(ld);
    isInLibrary = restore;
  }

  private void checkDeclaration(Declaration decl) {
    if (decl instanceof TypeDef && ((TypeDef)decl).getType() instanceof EnumType) {
      for (EnumValue ev : ((EnumType)((TypeDef)decl).getType()).values) {
        if (ev.getName().equals(index)) {
          results.add(ev);
          return;
        }
      }
    }

    if (start instanceof ViewReference) {
      ViewReference vref = (ViewReference)start;
      if (decl instanceof DesignUnit && vref.getDesignUnit().equals(decl.getName())) {
        DesignUnit du = (DesignUnit)decl;
        if (du.views.size() == 1 && vref.getName().isEmpty()) {
          results.add(du.views.get(0));
          return;
        }
        for (View v : du.views) {
          if (v.getName().equals(vref.getName())) {
            results.add(v);
            return;
          }
        }
      }
      if (decl instanceof View) {
        if (!(decl.getParent() instanceof DesignUnit))
          return;
        DesignUnit du = (DesignUnit)decl.getParent();
        if (!du.getName().equals(vref.getDesignUnit()))
          return;
        if (du.views.size() == 1 && vref.getName().isEmpty()) {
          results.add(du.views.get(0));
          return;
        }
      }
    }

    if (index.equals(decl.getName()) && symbol.getDeclarationType().isInstance(decl))
      results.add(decl);
  }

  //// Prefixed symbols ////

  private void manage() {
    switch (start.getKind()) {
    case FIELD_REFERENCE:
      manageFieldReference((FieldReference)start);
      break;
    case FUNCTION_CALL:
    case PROCEDURE_CALL:
      manageCall((Call)start);
      break;
    case INSTANCE:
      manageInstance((Instance)start);
      break;
    case PARAMETER_ASSIGN:
      manageParameterAssign((ParameterAssign)start);
      break;
    case PORT_ASSIGN:
      managePortAssign((PortAssign)start);
      break;
    case TYPE_TP_ASSIGN:
    case VALUE_TP_ASSIGN:
      manageTPAssign((TPAssign)start);
      break;
    default:
      // libraries, type and view references
      searchInParent(start);
      break;
    }
  }

  private DeclarationOptions nestedOptions() {
    DeclarationOptions ret = new DeclarationOptions(opt);
    ret.location = null;
    ret.forceRefresh = false;
    ret.error = false;
    return ret;
  }

  private void manageFieldReference(FieldReference ref) {
    Type prefixType = SemanticTypes.getSemanticType(ref.getPrefix(), sem);
    Type base = SemanticTypes.getBaseType(prefixType, false, sem);
    if (base == null)
      return;
    if (base instanceof RecordType) {
      for (Declaration field : ((RecordType)base).fields)
        if (field.getName().equals(index))
          results.add(field);
    } else if (base instanceof ViewReference) {
      Declaration view = DeclarationResolver.resolve((ViewReference)base, sem, nestedOptions());
      if (view instanceof View && ((View)view).getContents() != null)
        searchClass(((View)view).getContents());
    } else {
      // native records of some dialects have no declaration
      allowNotFound = true;
    }
  }

  private void searchClass(Contents contents) {
    boolean restore = checkOnlyClasses;
    checkOnlyClasses = true;
    dispatch(contents);
    checkOnlyClasses = restore;
  }

  private void manageCall(Call call) {
    if (call.getInstance() == null) {
      searchInParent(start);
      return;
    }
    Type instanceType = SemanticTypes.getBaseType(SemanticTypes.getSemanticType(call.getInstance(), sem), false, sem);
    if (instanceType instanceof ViewReference) {
      Declaration view = DeclarationResolver.resolve((ViewReference)instanceType, sem, nestedOptions());
      if (view instanceof View && ((View)view).getContents() != null) {
        searchClass(((View)view).getContents());
        if (!results.isEmpty())
          return;
      }
    }
    // methods of native types live in the standard libraries
    checkOnlyStandardLibraryDefs = true;
    searchInParent(start);
  }

  private void manageInstance(Instance inst) {
    Type referenced = inst.getReferencedType();
    if (referenced instanceof TypeReference)
      referenced = SemanticTypes.getBaseType(referenced, false, sem);
    if (!(referenced instanceof ViewReference)) {
      allowNotFound = true;
      return;
    }
    Declaration view = DeclarationResolver.resolve((ViewReference)referenced, sem, nestedOptions());
    if (view instanceof View && ((View)view).getEntity() != null)
      results.add(((View)view).getEntity());
  }

  private void manageParameterAssign(ParameterAssign pa) {
    if (!(pa.getParent() instanceof Call))
      return;
    Declaration decl = DeclarationResolver.resolve((Call)pa.getParent(), sem, nestedOptions());
    if (decl instanceof SubProgram)
      searchFormals(pa, ((SubProgram)decl).parameters);
  }

  private void managePortAssign(PortAssign pa) {
    if (!(pa.getParent() instanceof Instance))
      return;
    Declaration entity = DeclarationResolver.resolve((Instance)pa.getParent(), sem, nestedOptions());
    if (entity instanceof Entity)
      searchFormals(pa, ((Entity)entity).ports);
  }

  private void manageTPAssign(TPAssign tpa) {
    Node parent = tpa.getParent();
    if (!(parent instanceof Symbol))
      return;
    Declaration decl = DeclarationResolver.resolve((Symbol)parent, sem, nestedOptions());
    List<? extends Declaration> formals = null;
    if (decl instanceof SubProgram)
      formals = ((SubProgram)decl).templateParameters;
    else if (decl instanceof TypeDef)
      formals = ((TypeDef)decl).templateParameters;
    else if (decl instanceof View)
      formals = ((View)decl).templateParameters;
    if (formals != null)
      searchFormals(tpa, formals);
  }

  /** Named actuals match by name, positional actuals by their position in the actual list. */
  private void searchFormals(ReferencedAssign actual, List<? extends Declaration> formals) {
    if (actual.isNamed()) {
      for (Declaration d : formals)
        if (d.getName().equals(index) && symbol.getDeclarationType().isInstance(d))
          results.add(d);
      return;
    }
    int pos = actual.getOwnerList() == null ? -1 : actual.getOwnerList().indexOf(actual);
    if (pos >= 0 && pos < formals.size() && symbol.getDeclarationType().isInstance(formals.get(pos)))
      results.add(formals.get(pos));
  }
}
