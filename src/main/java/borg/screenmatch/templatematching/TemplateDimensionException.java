package borg.screenmatch.templatematching;

public class TemplateDimensionException extends IllegalArgumentException {

	private static final long serialVersionUID = -1873016342570458190L;

	private final int templateWidth;
	private final int templateHeight;
	private final int scanWidth;
	private final int scanHeight;

	public TemplateDimensionException(int templateWidth, int templateHeight, int scanWidth, int scanHeight) {
		super("Template " + templateWidth + "x" + templateHeight + " exceeds scan " + scanWidth + "x" + scanHeight);
		this.templateWidth = templateWidth;
		this.templateHeight = templateHeight;
		this.scanWidth = scanWidth;
		this.scanHeight = scanHeight;
	}

	public int getTemplateWidth() {
		return templateWidth;
	}

	public int getTemplateHeight() {
		return templateHeight;
	}

	public int getScanWidth() {
		return scanWidth;
	}

	public int getScanHeight() {
		return scanHeight;
	}

}
