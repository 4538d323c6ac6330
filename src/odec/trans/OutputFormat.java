package odec.trans;

public enum OutputFormat {
	SBML("sbml"),
	XPP("xpp");

	private final String name;

	OutputFormat(String name) {
		this.name = name;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the format with the given case-insensitive name, or null if there is none
	 */
	public static OutputFormat fromName(String name) {
		for (OutputFormat format : values()) {
			if (format.name.equalsIgnoreCase(name)) {
				return format;
			}
		}
		return null;
	}
}
