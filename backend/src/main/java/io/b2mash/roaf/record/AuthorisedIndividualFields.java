package io.b2mash.roaf.record;

/**
 * Catalog of Dataverse logical names read from the {@code dfsa_authorised_individual} entity and
 * its related entities. Every raw lookup in the projection goes through one of these constants.
 */
public final class AuthorisedIndividualFields {

  public static final String ID = "dfsa_authorised_individualid";

  // Step 0.1 / 0.2
  public static final String GUIDELINES_CONFIRM = "dfsa_iconfirmthatihavecarefullyreadandup";
  public static final String CONSENT_TO_DISCLOSURE =
      "cr5f7_doyouconsenttothedisclosureoftheinformatio";

  // Step 0.3
  public static final String FIRM_NAME = "dfsa_firmnamesd";
  public static final String FIRM_NUMBER = "cr5f7_firmnumber";
  public static final String REQUESTOR_NAME = "cr5f7_nameofpersonmakingthesubmission";
  public static final String REQUESTOR_POSITION = "dfsa_positiontitleofcontactperson";
  public static final String REQUESTOR_EMAIL = "dfsa_ai_emailaddress";
  public static final String REQUESTOR_PHONE = "dfsa_contacttelephonenumber";
  public static final String AUTHORISED_INDIVIDUAL_NAME = "dfsa_proposedauthorisedindividualname";

  // Step 1.1 flags and their dependent fields
  public static final String REP_OFFICE = "dfsa_ai_isthecandidateapplyingonbehalfofarepres";
  public static final String REP_OFFICE_FUNCTIONS =
      "dfsa_ai_pleaseindicatethefunctionsthecandidate";
  public static final String PREVIOUSLY_HELD = "dfsa_hasthecandidatepreviouslyheldauthorisedindiv";
  public static final String PREVIOUS_CANDIDATE = "cr5f7_pleaseselectcandidateup";
  public static final String APPLYING_AS_MLRO = "cr5f7_areyouapplyingasanmlro";
  public static final String OTHER_NAMES = "dfsa_hasthecandidateeverusedothernamesorchanged";
  public static final String STATE_OTHER_NAMES = "dfsa_stateothernames";
  public static final String NATIVE_NAME = "dfsa_nameinnativelanguageifapplicable";
  public static final String DATE_NAME_CHANGED = "cr5f7_datenamechanged1";
  public static final String REASON_FOR_NAME_CHANGE = "dfsa_reasonforchangeofname";

  // Contact
  public static final String ADDRESS = "dfsa_address";
  public static final String POSTCODE = "dfsa_postcodepobox";
  public static final String COUNTRY = "dfsa_countryauthindividual";
  public static final String MOBILE = "dfsa_mobiletelephonenumber";
  public static final String CONTACT_EMAIL = "dfsa_contactemailaddress";
  public static final String RESIDENCE_DURATION = "cr5f7_howlonghasthecandidateresidedattheabov";

  // Previous address
  public static final String PREVIOUS_ADDRESS = "dfsa_buildingnamenumber";
  public static final String PREVIOUS_POSTCODE = "dfsa_postcode_pobox";
  public static final String PREVIOUS_COUNTRY = "dfsa_country2";

  // Licensed functions
  public static final String LICENSED_FUNCTION = "dfsa_pleaseselectthelicensedfunctiontobecarried";
  public static final String SENIOR_EXECUTIVE_OFFICER = "dfsa_ml_seniorexecutiveofficer";
  public static final String FINANCE_OFFICER = "dfsa_ml_financeofficer";
  public static final String COMPLIANCE_OFFICER = "dfsa_ml_complianceofficer1";
  public static final String MLRO = "dfsa_ml_moneylaunderingreportingofficer";
  public static final String NO_MANDATORY_FUNCTION = "dfsa_ml_nomandatoryfunction";
  public static final String RESPONSIBLE_OFFICER_CONFIRMATION_1 =
      "cr5f7_theapplicanthassignificantresponsibilityfort";
  public static final String RESPONSIBLE_OFFICER_CONFIRMATION_2 =
      "cr5f7_theapplicantexercisesasignificantinfluenceon";
  public static final String RESPONSIBLE_OFFICER_CONFIRMATION_3 =
      "cr5f7_theapplicantisnotanemployeeoftheauthorised";
  public static final String EXECUTIVE_TYPE = "dfsa_ai_willthecandidatebeanexecutiveornonexecu";

  // Position
  public static final String PROPOSED_JOB_TITLE = "dfsa_whatisthecandidatesproposedjobtitle";
  public static final String HAS_START_DATE = "new_ai_doyouhaveproposedstartingdate";
  public static final String PROPOSED_START_DATE = "cr5f7_whatisthecandidatesproposedstartingdate";
  public static final String START_DATE_EXPLANATION = "new_ai_pleaseexplain";
  public static final String WILL_BE_MLRO = "new_ai_willthecandidateapplyingforprincipalrepre";

  public static final String HAS_REGULATORY_HISTORY =
      "dfsa_doesthecandidateholdorhaspreviouslyheldin";

  // Step 2.1 candidate profile (file columns; "_name" carries the uploaded file name)
  public static final String CV_FILE = "dfsa_pleaseuploadthecandidatescurriculumvitae";
  public static final String CV_FILE_NAME = "dfsa_pleaseuploadthecandidatescurriculumvitae_name";
  public static final String JOB_DESCRIPTION_FILE = "dfsa_pleaseuploadthecandidatesjobdescription";
  public static final String JOB_DESCRIPTION_FILE_NAME =
      "dfsa_pleaseuploadthecandidatesjobdescription_name";

  // Step 2.2 work experience
  public static final String HAS_DIFC_EXPERIENCE = "dfsa_hasthecandidatepreviouslyworkedinthedifc";
  public static final String DIFC_EXPERIENCE_OVERVIEW =
      "dfsa_pleaseprovideanoverviewofdifcexperience";
  public static final String DIFC_KNOWLEDGE_PLAN =
      "dfsa_pleaseexplainhowthecandidatewillobtainrelev";
  public static final String HAS_SIMILAR_ROLE_EXPERIENCE =
      "dfsa_hasthecandidatepreviouslyworkedinasimilarr";
  public static final String YEARS_OF_EXPERIENCE =
      "dfsa_howmanyyearsexperiencedoesthecandidatehave";
  public static final String EXPERIENCE_PLAN = "dfsa_howwillthecandidateobtaintherelevantexperie";

  // Related entity navigation properties
  public static final String PASSPORT_DETAILS = "cr5f7_AI_Q12_CandidateInfo";
  public static final String CITIZENSHIPS =
      "cr5f7_dfsa_Authorised_Individual_AI_Q13_CitizenshipInfo_dfsa_ROAF_authorised_Individual_AICIQ13";
  public static final String REGULATORY_HISTORY =
      "cr5f7_dfsa_Authorised_Individual_AI_Q28_LicenceDetails_dfsa_ROAF_authorised_Individual_AICIQ28";
  public static final String CAREER_HISTORY =
      "dfsa_Authorised_Individual_ROAF_Authorised_Individual_CHCCQ30_dfsa_ROAF_Authorised_Individual_";
  public static final String HIGHER_EDUCATION =
      "dfsa_Authorised_Individual_AICIQ_dfsa_authorised_individual_aiciq";
  public static final String PROFESSIONAL_QUALIFICATIONS =
      "dfsa_Authorised_Individual_AICIQ96_dfsa_authorised_individual_aiciq96";
  public static final String OTHER_QUALIFICATIONS =
      "dfsa_Authorised_Individual_AICIQ99_dfsa_authorised_individual_aiciq99";
  public static final String PROFESSIONAL_MEMBERSHIPS =
      "dfsa_Authorised_Individual_AICIQ102_dfsa_authorised_individual_aiciq102";
  public static final String OTHER_HOLDINGS =
      "dfsa_Authorised_Individual_OPOHQ117_dfsa_roaf_authorised_individual_opohq117";

  private AuthorisedIndividualFields() {}

  /** Passport details, entity {@code cr5f7_ai_q12_candidateinfo}. */
  public static final class CandidateInfo {
    public static final String TITLE = "dfsa_titlez";
    public static final String FULL_NAME = "dfsa_nameasitappearsintheprincipalpassport";
    public static final String DATE_OF_BIRTH = "cr5f7_dateofbirth1";
    public static final String DATE_OF_BIRTH_LEGACY = "dfsa_dateofbirth";
    public static final String PLACE_OF_BIRTH = "dfsa_placeofbirth";
    public static final String UAE_RESIDENT = "dfsa_uaeresident";
    public static final String NUMBER_OF_CITIZENSHIPS = "dfsa_no";
    public static final String OTHER_NAMES = "dfsa_othernames";
    public static final String NATIVE_NAME = "dfsa_nameinnativelanguageifapplicable";

    private CandidateInfo() {}
  }

  /** Citizenship rows, entity AICIQ13. */
  public static final class Citizenship {
    public static final String COUNTRY = "dfsa_countryterritory";
    public static final String PASSPORT_NO = "dfsa_passportno";
    public static final String EXPIRY_DATE = "cr5f7_expirydate1";
    public static final String EXPIRY_DATE_LEGACY = "dfsa_expirydate";

    private Citizenship() {}
  }

  /** Licence details, entity AICIQ28. */
  public static final class LicenceDetail {
    public static final String REGULATOR = "dfsa_regulator";
    public static final String DATE_STARTED = "dfsa_datestarted";
    public static final String DATE_FINISHED = "dfsa_datefinishedifapplicable";
    public static final String LICENSE_NAME = "dfsa_nameoflicenseregistration";
    public static final String REGISTER_NAME = "dfsa_nameoflicenseregister";
    public static final String OVERVIEW = "dfsa_briefoverviewoflicenseregistration";
    public static final String OTHER_REGULATOR_DETAILS =
        "dfsa_regulatorrownumberinq28pleaseprovidedet";

    private LicenceDetail() {}
  }

  /** Career history rows, entity CHCCQ30. */
  public static final class CareerHistory {
    public static final String ACTIVITY = "dfsa_activity";
    public static final String NAME_OF_ESTABLISHMENT = "dfsa_nameofestablishment";
    public static final String DATE_FROM = "dfsa_datefrom";
    public static final String DATE_TO = "dfsa_dateto";
    public static final String POSITION_TITLE = "dfsa_positiontitle";
    public static final String REASON_FOR_LEAVING = "dfsa_reasonforleaving";
    public static final String EXPLAIN_ACTIVITY = "dfsa_pleaseexplainactivity";
    public static final String EXPLAIN_REASON_FOR_LEAVING = "dfsa_pleaseexplainreasonforleaving";
    public static final String ACTIVITIES_UNDERTAKEN = "dfsa_activitiesundertakenbyemployer";
    public static final String ADDRESS = "dfsa_buildingnamenumber";
    public static final String STREET_NAME = "dfsa_streetname";
    public static final String DISTRICT = "dfsa_district";
    public static final String CITY = "dfsa_city";
    public static final String POSTCODE = "dfsa_postcodepobox";
    public static final String TELEPHONE = "dfsa_telephonenumber";
    public static final String CONTACT_PERSON = "dfsa_contactpersonwithinemployer";
    public static final String CONTACT_POSITION = "dfsa_positiontitleofcontactperson";
    public static final String CONTACT_TELEPHONE = "dfsa_contacttelephonenumber";
    public static final String CONTACT_EMAIL = "dfsa_contactemailaddress";
    public static final String IS_REGULATED = "dfsa_iswasregulated";
    public static final String REGULATOR = "dfsa_pleaseselect";
    public static final String REGULATOR_DETAILS = "dfsa_pleaseprovidedetailsoftheregulator";
    public static final String ACTIVITY_DETAILS = "dfsa_pleaseprovidedetailsofyouractivitieswithn";

    private CareerHistory() {}
  }

  /** Higher education rows, entity AICIQ. */
  public static final class HigherEducation {
    public static final String TITLE = "dfsa_titleofqualification";
    public static final String UNIVERSITY = "dfsa_fullnameofuniversity";
    public static final String DATE_OF_AWARD = "dfsa_dateofaward";
    public static final String CLASSIFICATION = "dfsa_generalclassificationofqualification";

    private HigherEducation() {}
  }

  /** Professional and other qualification rows, entities AICIQ96 and AICIQ99. */
  public static final class Qualification {
    public static final String NAME = "dfsa_fullnameofqualification";
    public static final String INSTITUTE = "dfsa_fullnameofinstitute";
    public static final String DATE_OF_AWARD = "dfsa_dateofaward";

    private Qualification() {}
  }

  /** Professional membership rows, entity AICIQ102. */
  public static final class Membership {
    public static final String ORGANISATION = "dfsa_fullnameoforganisation";
    public static final String DATE_OF_ADMISSION = "dfsa_dateofadmissionmembership";
    public static final String EXPLANATION = "dfsa_briefexplanationoforganisation";

    private Membership() {}
  }

  /** Positions of controller, director or partner, entity OPOHQ117. */
  public static final class OtherHolding {
    public static final String NAME_OF_ENTITY = "dfsa_nameofentity";
    public static final String DETAILS_OF_POSITION = "dfsa_detailsofposition";
    public static final String DATE_FROM = "dfsa_from";
    public static final String DATE_TO = "dfsa_toleaveblankifcurrent";
    public static final String ADDRESS = "dfsa_address";
    public static final String NATURE_OF_BUSINESS = "dfsa_natureofbusiness";
    public static final String OWNERSHIP_TEXT = "dfsa_ownershipifapplicable";
    public static final String OWNERSHIP_PERCENTAGE = "dfsa_auth_ind_ownershipifapplicable";
    public static final String IS_REGULATED = "dfsa_regulated";
    public static final String REGULATOR = "dfsa_regulator";
    public static final String HAS_CONFLICT_OF_INTEREST = "dfsa_anypotentialconflictofinterest";
    public static final String CONFLICT_CLARIFICATION = "dfsa_potentialconflictclarification";

    private OtherHolding() {}
  }
}
