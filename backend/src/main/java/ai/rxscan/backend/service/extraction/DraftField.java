package ai.rxscan.backend.service.extraction;

import ai.rxscan.backend.model.dto.PrescriptionDraft;

import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * The fields a draft can report as extracted, in summary order.
 *
 * <p>Scalar fields carry the cascade that fills them and the draft property it writes to;
 * adding a field means adding a constant here and a cascade in {@link FieldExtractors}.
 * {@link #MEDICATIONS} is filled by the medication pipeline instead.
 */
public enum DraftField {

    PATIENT_NAME("Patient Name", FieldExtractors.PATIENT_NAME,
            PrescriptionDraft::getPatientName, PrescriptionDraft::setPatientName),
    PATIENT_EMAIL("Patient Email", FieldExtractors.PATIENT_EMAIL,
            PrescriptionDraft::getPatientEmail, PrescriptionDraft::setPatientEmail),
    PATIENT_MOBILE("Patient Phone", FieldExtractors.PATIENT_MOBILE,
            PrescriptionDraft::getPatientMobile, PrescriptionDraft::setPatientMobile),
    DOCTOR_NAME("Doctor Name", FieldExtractors.DOCTOR_NAME,
            PrescriptionDraft::getDoctorName, PrescriptionDraft::setDoctorName),
    DOCTOR_EMAIL("Doctor Email", FieldExtractors.DOCTOR_EMAIL,
            PrescriptionDraft::getDoctorEmail, PrescriptionDraft::setDoctorEmail),
    DOCTOR_MOBILE("Doctor Phone", FieldExtractors.DOCTOR_MOBILE,
            PrescriptionDraft::getDoctorMobile, PrescriptionDraft::setDoctorMobile),
    CLINIC_NAME("Clinic Name", FieldExtractors.CLINIC_NAME,
            PrescriptionDraft::getClinicName, PrescriptionDraft::setClinicName),
    CLINIC_ADDRESS("Clinic Address", FieldExtractors.CLINIC_ADDRESS,
            PrescriptionDraft::getClinicAddress, PrescriptionDraft::setClinicAddress),
    AGE("Age", FieldExtractors.AGE,
            PrescriptionDraft::getAge, PrescriptionDraft::setAge),
    WEIGHT("Weight", FieldExtractors.WEIGHT,
            PrescriptionDraft::getWeight, PrescriptionDraft::setWeight),
    HEIGHT("Height", FieldExtractors.HEIGHT,
            PrescriptionDraft::getHeight, PrescriptionDraft::setHeight),
    MEDICATIONS("Medications", null, null, null) {
        @Override
        public boolean isPopulated(PrescriptionDraft draft) {
            return !draft.getMedications().isEmpty();
        }

        @Override
        public String summaryLabel(PrescriptionDraft draft) {
            return draft.getMedications().size() + " Medications";
        }
    },
    INSTRUCTIONS("Instructions", FieldExtractors.INSTRUCTIONS,
            PrescriptionDraft::getInstructions, PrescriptionDraft::setInstructions),
    EXPIRES_AT("Expiry Date", FieldExtractors.EXPIRES_AT,
            PrescriptionDraft::getExpiresAt, PrescriptionDraft::setExpiresAt);

    private final String label;
    private final FieldCascade cascade;
    private final Function<PrescriptionDraft, String> getter;
    private final BiConsumer<PrescriptionDraft, String> setter;

    DraftField(String label, FieldCascade cascade,
               Function<PrescriptionDraft, String> getter, BiConsumer<PrescriptionDraft, String> setter) {
        this.label = label;
        this.cascade = cascade;
        this.getter = getter;
        this.setter = setter;
    }

    public boolean isScalar() {
        return cascade != null;
    }

    /**
     * Runs this field's cascade over the text and stores the result in the draft.
     */
    public void populate(PrescriptionDraft draft, String text) {
        if (!isScalar()) {
            throw new UnsupportedOperationException(name() + " is not a scalar field");
        }
        setter.accept(draft, cascade.extract(text));
    }

    public boolean isPopulated(PrescriptionDraft draft) {
        return !getter.apply(draft).isEmpty();
    }

    public String summaryLabel(PrescriptionDraft draft) {
        return label;
    }
}
