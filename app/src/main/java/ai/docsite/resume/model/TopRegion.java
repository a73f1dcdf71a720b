package ai.docsite.resume.model;

public record TopRegion(boolean showProfessionalProfile) {
}
