package knitscript.modules;

public class ModuleLoadError extends Exception {

	private static final long serialVersionUID = -6101906410872650398L;

	private final String moduleName;

	public ModuleLoadError(String name, Exception cause) {
		super("error loading module \"" + name + "\": " + cause.getMessage(), cause);
		this.moduleName = name;
	}

	public String getModuleName() {
		return moduleName;
	}
}
