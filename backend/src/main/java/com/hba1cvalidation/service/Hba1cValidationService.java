package com.hba1cvalidation.service;

import com.hba1cvalidation.dto.BatchDTO;
import com.hba1cvalidation.dto.ModelDTO;
import com.hba1cvalidation.dto.ValidationDTO;
import com.hba1cvalidation.exception.ErrorType;
import com.hba1cvalidation.exception.HbA1cValidationException;
import com.hba1cvalidation.exception.InvalidRecordException;
import com.hba1cvalidation.ml.AnomalyDetector;
import com.hba1cvalidation.ml.AssessmentResult;
import com.hba1cvalidation.ml.ClinicalDecisionSupport;
import com.hba1cvalidation.ml.DisorderClassifier;
import com.hba1cvalidation.ml.HbA1cCorrector;
import com.hba1cvalidation.ml.ModelSuite;
import com.hba1cvalidation.model.LabField;
import com.hba1cvalidation.model.PatientRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
public class Hba1cValidationService {

    public static final String SERVICE_NAME = "HbA1c Validation API";

    private final ModelRegistry registry;
    private final PatientRecordMapper recordMapper;
    private final AssessmentMapper assessmentMapper;

    /**
     * Full validation of one HbA1c result
     */
    public ValidationDTO.AssessmentResponse assess(Map<String, Object> payload) {
        ClinicalDecisionSupport cds = registry.requireReady();
        AssessmentResult result = cds.assessTestResult(recordMapper.toRecord(payload));
        log.info("Validated HbA1c for patient {}: reliable={}", result.getPatientId(), result.isReliable());

        return ValidationDTO.AssessmentResponse.builder()
            .success(true)
            .timestamp(Instant.now())
            .assessment(assessmentMapper.toDto(result))
            .build();
    }

    public ValidationDTO.AnomalyResponse detectAnomaly(Map<String, Object> payload) {
        ClinicalDecisionSupport cds = registry.requireReady();
        PatientRecord record = recordMapper.toRecord(payload);
        return ValidationDTO.AnomalyResponse.builder()
            .success(true)
            .patientId(record.getPatientId())
            .anomalyDetection(assessmentMapper.toDto(cds.detectAnomaly(record)))
            .build();
    }

    public ValidationDTO.DisorderResponse predictDisorder(Map<String, Object> payload) {
        ClinicalDecisionSupport cds = registry.requireReady();
        PatientRecord record = recordMapper.toRecord(payload);
        return ValidationDTO.DisorderResponse.builder()
            .success(true)
            .patientId(record.getPatientId())
            .disorderPrediction(assessmentMapper.toDto(cds.predictDisorder(record)))
            .build();
    }

    public ValidationDTO.CorrectionResponse correctHba1c(Map<String, Object> payload) {
        ClinicalDecisionSupport cds = registry.requireReady();
        PatientRecord record = recordMapper.toRecord(payload);
        return ValidationDTO.CorrectionResponse.builder()
            .success(true)
            .patientId(record.getPatientId())
            .correction(assessmentMapper.toDto(cds.correctHba1c(record)))
            .build();
    }

    /**
     * Assesses every record independently; a failing record is reported in place
     * and does not stop the rest of the batch.
     */
    public BatchDTO.Response batchAssess(BatchDTO.Request request) {
        ClinicalDecisionSupport cds = registry.requireReady();
        List<Map<String, Object>> patients = request == null ? null : request.getPatients();
        if (patients == null || patients.isEmpty()) {
            throw new InvalidRecordException("No patient data provided: 'patients' must be a non-empty list",
                List.of("patients"));
        }

        List<BatchDTO.Item> results = new ArrayList<>(patients.size());
        int unreliable = 0;
        int failed = 0;
        for (Map<String, Object> payload : patients) {
            try {
                AssessmentResult result = cds.assessTestResult(recordMapper.toRecord(payload));
                if (!result.isReliable()) {
                    unreliable++;
                }
                results.add(BatchDTO.Item.builder()
                    .success(true)
                    .patientId(result.getPatientId())
                    .assessment(assessmentMapper.toDto(result))
                    .build());
            } catch (HbA1cValidationException e) {
                failed++;
                results.add(failure(payload, e.getMessage(), e.getErrorType()));
            } catch (RuntimeException e) {
                log.error("Unexpected failure assessing patient {}", PatientRecordMapper.patientIdOf(payload), e);
                failed++;
                results.add(failure(payload, e.getMessage(), ErrorType.INTERNAL_ERROR));
            }
        }
        log.info("Batch validated {} patients: {} unreliable, {} failed", patients.size(), unreliable, failed);

        return BatchDTO.Response.builder()
            .success(true)
            .timestamp(Instant.now())
            .totalPatients(patients.size())
            .processed(results.size())
            .unreliableTests(unreliable)
            .failed(failed)
            .results(results)
            .build();
    }

    public ModelDTO.ModelInfoResponse modelInfo() {
        ClinicalDecisionSupport cds = registry.requireReady();
        ModelSuite suite = cds.currentSuite()
            .orElseThrow(() -> new IllegalStateException("Healthy registry without a model suite"));

        return ModelDTO.ModelInfoResponse.builder()
            .success(true)
            .models(ModelDTO.Models.builder()
                .anomalyDetector(ModelDTO.ModelDetails.builder()
                    .trained(suite.getAnomalyDetector().isTrained())
                    .type(AnomalyDetector.MODEL_TYPE)
                    .build())
                .disorderClassifier(ModelDTO.ModelDetails.builder()
                    .trained(suite.getDisorderClassifier().isTrained())
                    .type(DisorderClassifier.MODEL_TYPE)
                    .categories(suite.getDisorderClassifier().getCategories())
                    .build())
                .hba1cCorrector(ModelDTO.ModelDetails.builder()
                    .trained(suite.getHba1cCorrector().isTrained())
                    .type(HbA1cCorrector.MODEL_TYPE)
                    .build())
                .build())
            .trainingDataSize(suite.getTrainingSize())
            .trainedAt(suite.getTrainedAt())
            .build();
    }

    public ModelDTO.HealthResponse health() {
        ModelState state = registry.current();
        return ModelDTO.HealthResponse.builder()
            .status(state.getStatus().code())
            .modelsLoaded(state.isReady())
            .error(state.failure().orElse(null))
            .timestamp(Instant.now())
            .service(SERVICE_NAME)
            .build();
    }

    public ModelDTO.ExampleRequestResponse exampleRequest() {
        Map<String, Object> example = new LinkedHashMap<>();
        example.put(PatientRecordMapper.PATIENT_ID, "P12345");
        example.put(PatientRecordMapper.HBA1C, 7.2);
        example.put(PatientRecordMapper.FASTING_GLUCOSE, 120);
        example.put(PatientRecordMapper.HAEMOGLOBIN, 9.5);
        example.put(LabField.RANDOM_GLUCOSE.getKey(), 140);
        example.put(LabField.OGTT_2HR.getKey(), 160);
        example.put(LabField.AVG_GLUCOSE_CGM.getKey(), 125);
        example.put(LabField.RBC_COUNT.getKey(), 4.2);
        example.put(LabField.MCV.getKey(), 75);
        example.put(LabField.MCH.getKey(), 25);
        example.put(LabField.MCHC.getKey(), 32);
        example.put(LabField.RETICULOCYTE_COUNT.getKey(), 0.8);
        example.put(LabField.WBC_COUNT.getKey(), 6.5);
        example.put(LabField.PLATELET_COUNT.getKey(), 280);
        example.put(LabField.SERUM_IRON.getKey(), 30);
        example.put(LabField.FERRITIN.getKey(), 12);
        example.put(LabField.TRANSFERRIN_SATURATION.getKey(), 15);
        example.put(LabField.TIBC.getKey(), 450);
        example.put(LabField.BILIRUBIN.getKey(), 0.6);
        example.put(LabField.LDH.getKey(), 140);
        example.put(LabField.HAPTOGLOBIN.getKey(), 100);
        example.put(LabField.AGE.getKey(), 35);
        example.put(PatientRecordMapper.GENDER, "F");
        example.put(LabField.RBC_LIFESPAN_DAYS.getKey(), 90);

        List<String> optional = new ArrayList<>();
        for (LabField field : LabField.values()) {
            optional.add(field.getKey());
        }
        optional.add(PatientRecordMapper.GENDER);
        optional.add(PatientRecordMapper.DISORDER);

        return ModelDTO.ExampleRequestResponse.builder()
            .exampleRequest(example)
            .requiredFields(PatientRecordMapper.REQUIRED_FIELDS)
            .optionalFields(optional)
            .build();
    }

    private static BatchDTO.Item failure(Map<String, Object> payload, String message, ErrorType type) {
        return BatchDTO.Item.builder()
            .success(false)
            .patientId(PatientRecordMapper.patientIdOf(payload))
            .error(message)
            .errorType(type.name())
            .build();
    }
}
