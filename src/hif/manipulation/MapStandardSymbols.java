package hif.manipulation;

import hif.diag.DiagnosticBatch;
import hif.model.Declaration;
import hif.model.FunctionCall;
import hif.model.Instance;
import hif.model.Library;
import hif.model.LibraryDef;
import hif.model.Node;
import hif.model.ReferencedAssign;
import hif.model.Scope;
import hif.model.Symbol;
import hif.model.Value;
import hif.semantics.DeclarationResolver;
import hif.semantics.LanguageSemantics;
import hif.semantics.MapAction;
import hif.semantics.MappedSymbol;
import hif.util.TreeWalker;
import hif.util.Trees;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Moves references to standard declarations of one semantics over to the standard libraries of
 * another. Symbols without an equivalent are collected and reported together after the pass.
 */
public class MapStandardSymbols {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  private final LanguageSemantics srcSem;
  private final LanguageSemantics dstSem;
  private final DiagnosticBatch batch;
  /** Source libraries whose mapped declarations are dropped. */
  private final Set<String> droppedLibraries = new LinkedHashSet<>();
  private int mapped = 0;

  private MapStandardSymbols(LanguageSemantics srcSem, LanguageSemantics dstSem) {
    this.srcSem = srcSem;
    this.dstSem = dstSem;
    this.batch = new DiagnosticBatch("MapStandardSymbols", dstSem.getName());
  }

  /**
   * Runs the pass.
   * @return the number of mapped or simplified symbols
   * @throws hif.diag.HifException listing every unsupported symbol, after the whole tree is processed
   */
  public static int run(Node root, LanguageSemantics srcSem, LanguageSemantics dstSem) {
    MapStandardSymbols pass = new MapStandardSymbols(srcSem, dstSem);
    // collect first: mapping replaces nodes
    List<Symbol> symbols = new ArrayList<>();
    for (Symbol sym : TreeWalker.collect(root, Symbol.class))
      if (!(sym instanceof ReferencedAssign || sym instanceof Library || sym instanceof Instance))
        symbols.add(sym);
    for (Symbol sym : symbols)
      pass.map(sym);
    pass.removeUnusedImports(root);
    logger.info("Mapped {} standard symbols from {} to {}", pass.mapped, srcSem.getName(), dstSem.getName());
    pass.batch.reportAndThrow();
    return pass.mapped;
  }

  private void map(Symbol sym) {
    Declaration decl = DeclarationResolver.resolve(sym, srcSem);
    if (decl == null)
      return;
    MappedSymbol target = dstSem.mapStandardSymbol(decl, srcSem);
    switch (target.action()) {
    case UNKNOWN:
      return;
    case MAP_KEEP:
    case MAP_DELETE:
      rebind(sym, decl, target);
      return;
    case SIMPLIFIED:
      simplify(sym);
      return;
    case UNSUPPORTED:
    default:
      batch.add("Standard symbol '" + decl.getName() + "' has no equivalent in semantics " + dstSem.getName(), (Node)sym);
    }
  }

  private void rebind(Symbol sym, Declaration decl, MappedSymbol target) {
    LibraryDef lib = dstSem.getStandardLibrary(target.libraryName());
    if (lib == null) {
      batch.add("Unknown standard library '" + target.libraryName() + "'", (Node)sym);
      return;
    }
    Declaration targetDecl = null;
    for (Declaration d : lib.declarations) {
      if (d.getName().equals(target.symbolName()) && sym.getDeclarationType().isInstance(d)) {
        targetDecl = d;
        break;
      }
    }
    if (targetDecl == null) {
      batch.add("Standard library '" + lib.getName() + "' has no '" + target.symbolName() + "'", (Node)sym);
      return;
    }
    logger.debug("Mapping {} to {}.{}", sym, lib.getName(), targetDecl.getName());
    sym.setName(target.symbolName());
    DeclarationResolver.bind(sym, targetDecl);
    if (!dstSem.getImplicitLibraries().contains(lib))
      addImport((Node)sym, lib);
    if (target.action() == MapAction.MAP_DELETE) {
      LibraryDef srcLib = Trees.getNearestParent(decl, LibraryDef.class, false).orElse(null);
      if (srcLib != null)
        droppedLibraries.add(srcLib.getName());
    }
    ++mapped;
  }

  private void simplify(Symbol sym) {
    if (sym instanceof FunctionCall && ((FunctionCall)sym).parameterAssigns.size() == 1) {
      FunctionCall call = (FunctionCall)sym;
      Value arg = call.parameterAssigns.get(0).getValue();
      if (arg != null && call.getParent() != null) {
        arg.detach();
        call.replace(arg);
        ++mapped;
        return;
      }
    }
    batch.add("Cannot simplify '" + sym.getName() + "'", (Node)sym);
  }

  private void addImport(Node from, LibraryDef lib) {
    Scope scope = Trees.getNearestScope(from, false, true, false).orElse(null);
    if (scope == null || scope.getLibraries() == null)
      return;
    for (Library l : scope.getLibraries())
      if (l.getName().equals(lib.getName()))
        return;
    Library imp = new Library(lib.getName(), false);
    imp.setDeclaration(lib);
    scope.getLibraries().add(imp);
  }

  /** Drops imports of source libraries that nothing refers to anymore. */
  private void removeUnusedImports(Node root) {
    if (droppedLibraries.isEmpty())
      return;
    Set<String> used = new LinkedHashSet<>();
    TreeWalker.forEach(root, node -> {
      if (!(node instanceof Symbol) || node instanceof Library)
        return;
      Declaration d = ((Symbol)node).getDeclaration();
      LibraryDef lib = d == null ? null : Trees.getNearestParent(d, LibraryDef.class, false).orElse(null);
      if (lib != null)
        used.add(lib.getName());
    });
    for (Library imp : TreeWalker.collect(root, Library.class)) {
      if (!droppedLibraries.contains(imp.getName()) || used.contains(imp.getName()))
        continue;
      if (imp.isInList()) {
        logger.debug("Removing import of {}", imp.getName());
        imp.detach();
      }
    }
  }
}
