package com.calldash.calldash.enrich;

import java.util.Locale;
import java.util.Map;

/**
 * Fixed lookup tables used by the enrichment passes.
 */
public final class ReferenceTables {

    private ReferenceTables() {
    }

    /**
     * Approximate geographic centre of a US state or Canadian province.
     */
    public record Coordinates(double latitude, double longitude) {
    }

    private static final Map<String, String> AREA_CODE_CARRIERS = Map.ofEntries(
            Map.entry("201", "Verizon/AT&T"),
            Map.entry("202", "Verizon/AT&T"),
            Map.entry("203", "AT&T"),
            Map.entry("212", "Verizon"),
            Map.entry("213", "AT&T"),
            Map.entry("214", "AT&T"),
            Map.entry("310", "AT&T/T-Mobile"),
            Map.entry("312", "AT&T"),
            Map.entry("313", "AT&T"),
            Map.entry("404", "AT&T"),
            Map.entry("408", "AT&T"),
            Map.entry("415", "AT&T"),
            Map.entry("469", "AT&T"),
            Map.entry("512", "AT&T"),
            Map.entry("602", "T-Mobile"),
            Map.entry("619", "AT&T"),
            Map.entry("626", "AT&T"),
            Map.entry("650", "AT&T"),
            Map.entry("702", "T-Mobile"),
            Map.entry("713", "AT&T"),
            Map.entry("714", "AT&T"),
            Map.entry("718", "Verizon"),
            Map.entry("720", "T-Mobile"),
            Map.entry("760", "Verizon"),
            Map.entry("818", "AT&T"),
            Map.entry("858", "AT&T"),
            Map.entry("909", "Verizon"),
            Map.entry("916", "AT&T"),
            Map.entry("917", "Verizon"),
            Map.entry("949", "AT&T"),
            Map.entry("951", "Verizon"),
            Map.entry("972", "AT&T")
    );

    private static final Map<String, Coordinates> STATE_COORDINATES = Map.ofEntries(
            Map.entry("AL", new Coordinates(32.806671, -86.791130)),
            Map.entry("AK", new Coordinates(61.370716, -152.404419)),
            Map.entry("AZ", new Coordinates(33.729759, -111.431221)),
            Map.entry("AR", new Coordinates(34.969704, -92.373123)),
            Map.entry("CA", new Coordinates(36.116203, -119.681564)),
            Map.entry("CO", new Coordinates(39.059811, -105.311104)),
            Map.entry("CT", new Coordinates(41.597782, -72.755371)),
            Map.entry("DE", new Coordinates(39.318523, -75.507141)),
            Map.entry("FL", new Coordinates(27.766279, -81.686783)),
            Map.entry("GA", new Coordinates(33.040619, -83.643074)),
            Map.entry("HI", new Coordinates(21.094318, -157.498337)),
            Map.entry("ID", new Coordinates(44.240459, -114.478828)),
            Map.entry("IL", new Coordinates(40.349457, -88.986137)),
            Map.entry("IN", new Coordinates(39.849426, -86.258278)),
            Map.entry("IA", new Coordinates(42.011539, -93.210526)),
            Map.entry("KS", new Coordinates(38.526600, -96.726486)),
            Map.entry("KY", new Coordinates(37.668140, -84.670067)),
            Map.entry("LA", new Coordinates(31.169546, -91.867805)),
            Map.entry("ME", new Coordinates(44.693947, -69.381927)),
            Map.entry("MD", new Coordinates(39.063946, -76.802101)),
            Map.entry("MA", new Coordinates(42.230171, -71.530106)),
            Map.entry("MI", new Coordinates(43.326618, -84.536095)),
            Map.entry("MN", new Coordinates(45.694454, -93.900192)),
            Map.entry("MS", new Coordinates(32.741646, -89.678696)),
            Map.entry("MO", new Coordinates(38.456085, -92.288368)),
            Map.entry("MT", new Coordinates(46.921925, -110.454353)),
            Map.entry("NE", new Coordinates(41.125370, -98.268082)),
            Map.entry("NV", new Coordinates(38.313515, -117.055374)),
            Map.entry("NH", new Coordinates(43.452492, -71.563896)),
            Map.entry("NJ", new Coordinates(40.298904, -74.521011)),
            Map.entry("NM", new Coordinates(34.840515, -106.248482)),
            Map.entry("NY", new Coordinates(42.165726, -74.948051)),
            Map.entry("NC", new Coordinates(35.630066, -79.806419)),
            Map.entry("ND", new Coordinates(47.528912, -99.784012)),
            Map.entry("OH", new Coordinates(40.388783, -82.764915)),
            Map.entry("OK", new Coordinates(35.565342, -96.928917)),
            Map.entry("OR", new Coordinates(44.572021, -122.070938)),
            Map.entry("PA", new Coordinates(40.590752, -77.209755)),
            Map.entry("RI", new Coordinates(41.680893, -71.511780)),
            Map.entry("SC", new Coordinates(33.856892, -80.945007)),
            Map.entry("SD", new Coordinates(44.299782, -99.438828)),
            Map.entry("TN", new Coordinates(35.747845, -86.692345)),
            Map.entry("TX", new Coordinates(31.054487, -97.563461)),
            Map.entry("UT", new Coordinates(40.150032, -111.862434)),
            Map.entry("VT", new Coordinates(44.045876, -72.710686)),
            Map.entry("VA", new Coordinates(37.769337, -78.169968)),
            Map.entry("WA", new Coordinates(47.400902, -121.490494)),
            Map.entry("WV", new Coordinates(38.491226, -80.954453)),
            Map.entry("WI", new Coordinates(44.268543, -89.616508)),
            Map.entry("WY", new Coordinates(42.755966, -107.302490)),
            Map.entry("DC", new Coordinates(38.897438, -77.026817)),
            Map.entry("ON", new Coordinates(51.253775, -85.323214)),
            Map.entry("QC", new Coordinates(52.939916, -73.549136)),
            Map.entry("BC", new Coordinates(53.726669, -127.647621)),
            Map.entry("AB", new Coordinates(53.933271, -116.576503))
    );

    private static final Map<String, String> STATE_TIMEZONES = Map.ofEntries(
            Map.entry("AL", "America/Chicago"),
            Map.entry("AK", "America/Anchorage"),
            Map.entry("AZ", "America/Phoenix"),
            Map.entry("AR", "America/Chicago"),
            Map.entry("CA", "America/Los_Angeles"),
            Map.entry("CO", "America/Denver"),
            Map.entry("CT", "America/New_York"),
            Map.entry("DE", "America/New_York"),
            Map.entry("FL", "America/New_York"),
            Map.entry("GA", "America/New_York"),
            Map.entry("HI", "Pacific/Honolulu"),
            Map.entry("ID", "America/Boise"),
            Map.entry("IL", "America/Chicago"),
            Map.entry("IN", "America/Indiana/Indianapolis"),
            Map.entry("IA", "America/Chicago"),
            Map.entry("KS", "America/Chicago"),
            Map.entry("KY", "America/New_York"),
            Map.entry("LA", "America/Chicago"),
            Map.entry("ME", "America/New_York"),
            Map.entry("MD", "America/New_York"),
            Map.entry("MA", "America/New_York"),
            Map.entry("MI", "America/Detroit"),
            Map.entry("MN", "America/Chicago"),
            Map.entry("MS", "America/Chicago"),
            Map.entry("MO", "America/Chicago"),
            Map.entry("MT", "America/Denver"),
            Map.entry("NE", "America/Chicago"),
            Map.entry("NV", "America/Los_Angeles"),
            Map.entry("NH", "America/New_York"),
            Map.entry("NJ", "America/New_York"),
            Map.entry("NM", "America/Denver"),
            Map.entry("NY", "America/New_York"),
            Map.entry("NC", "America/New_York"),
            Map.entry("ND", "America/Chicago"),
            Map.entry("OH", "America/New_York"),
            Map.entry("OK", "America/Chicago"),
            Map.entry("OR", "America/Los_Angeles"),
            Map.entry("PA", "America/New_York"),
            Map.entry("RI", "America/New_York"),
            Map.entry("SC", "America/New_York"),
            Map.entry("SD", "America/Chicago"),
            Map.entry("TN", "America/Chicago"),
            Map.entry("TX", "America/Chicago"),
            Map.entry("UT", "America/Denver"),
            Map.entry("VT", "America/New_York"),
            Map.entry("VA", "America/New_York"),
            Map.entry("WA", "America/Los_Angeles"),
            Map.entry("WV", "America/New_York"),
            Map.entry("WI", "America/Chicago"),
            Map.entry("WY", "America/Denver"),
            Map.entry("DC", "America/New_York"),
            Map.entry("ON", "America/Toronto"),
            Map.entry("QC", "America/Montreal"),
            Map.entry("BC", "America/Vancouver"),
            Map.entry("AB", "America/Edmonton"),
            Map.entry("MB", "America/Winnipeg"),
            Map.entry("SK", "America/Regina"),
            Map.entry("NS", "America/Halifax"),
            Map.entry("NB", "America/Moncton"),
            Map.entry("NL", "America/St_Johns")
    );

    // Keyed by upper-cased county name.
    private static final Map<String, String> CA_COUNTY_ASSESSORS = Map.ofEntries(
            Map.entry("ALAMEDA", "https://www.acgov.org/assessor/search/"),
            Map.entry("ALPINE", "https://www.alpinecountyca.gov/192/Assessor"),
            Map.entry("AMADOR", "https://www.amadorgov.org/government/assessor"),
            Map.entry("BUTTE", "https://www.buttecounty.net/assessor"),
            Map.entry("CALAVERAS", "https://assessor.calaverasgov.us/"),
            Map.entry("COLUSA", "https://www.countyofcolusa.org/148/Assessor"),
            Map.entry("CONTRA COSTA", "https://www.contracosta.ca.gov/191/Assessor"),
            Map.entry("DEL NORTE", "https://www.dnco.org/departments/assessor/"),
            Map.entry("EL DORADO", "https://www.edcgov.us/Government/Assessor"),
            Map.entry("FRESNO", "https://www.fresnocountyca.gov/Departments/Assessor-Recorder"),
            Map.entry("GLENN", "https://www.countyofglenn.net/dept/assessor"),
            Map.entry("HUMBOLDT", "https://humboldtgov.org/186/Assessor"),
            Map.entry("IMPERIAL", "https://assessor.imperialcounty.org/"),
            Map.entry("INYO", "https://www.inyocounty.us/services/assessor"),
            Map.entry("KERN", "https://assessor.kerncounty.com/"),
            Map.entry("KINGS", "https://www.countyofkings.com/departments/finance/assessor"),
            Map.entry("LAKE", "https://www.lakecountyca.gov/Government/Directory/Assessor_Recorder.htm"),
            Map.entry("LASSEN", "https://www.lassencounty.org/dept/assessor/assessor.htm"),
            Map.entry("LOS ANGELES", "https://portal.assessor.lacounty.gov/"),
            Map.entry("MADERA", "https://www.maderacounty.com/government/assessor"),
            Map.entry("MARIN", "https://www.marincounty.org/depts/ar"),
            Map.entry("MARIPOSA", "https://www.mariposacounty.org/167/Assessor-Recorder"),
            Map.entry("MENDOCINO", "https://www.mendocinocounty.org/government/assessor-county-clerk-recorder"),
            Map.entry("MERCED", "https://www.co.merced.ca.us/96/Assessor"),
            Map.entry("MODOC", "https://www.modoccounty.us/assessor/"),
            Map.entry("MONO", "https://monocounty.ca.gov/assessor"),
            Map.entry("MONTEREY", "https://www.co.monterey.ca.us/government/departments-a-h/assessor"),
            Map.entry("NAPA", "https://www.countyofnapa.org/197/Assessor"),
            Map.entry("NEVADA", "https://www.mynevadacounty.com/188/Assessor"),
            Map.entry("ORANGE", "https://www.ocassessor.gov/"),
            Map.entry("PLACER", "https://www.placer.ca.gov/1573/Assessor"),
            Map.entry("PLUMAS", "https://www.plumascounty.us/138/Assessor"),
            Map.entry("RIVERSIDE", "https://www.asrclkrec.com/"),
            Map.entry("SACRAMENTO", "https://assessor.saccounty.gov/"),
            Map.entry("SAN BENITO", "https://www.cosb.us/departments/assessor"),
            Map.entry("SAN BERNARDINO", "https://www.sbcounty.gov/assessor/"),
            Map.entry("SAN DIEGO", "https://arcc.sdcounty.ca.gov/"),
            Map.entry("SAN FRANCISCO", "https://sfassessor.org/"),
            Map.entry("SAN JOAQUIN", "https://www.sjgov.org/department/assessor"),
            Map.entry("SAN LUIS OBISPO", "https://www.slocounty.ca.gov/Departments/Assessor.aspx"),
            Map.entry("SAN MATEO", "https://www.smcacre.org/"),
            Map.entry("SANTA BARBARA", "https://www.countyofsb.org/505/Assessor"),
            Map.entry("SANTA CLARA", "https://www.sccassessor.org/"),
            Map.entry("SANTA CRUZ", "https://www.co.santa-cruz.ca.us/Departments/AssessorHome.aspx"),
            Map.entry("SHASTA", "https://www.shastacounty.gov/assessor"),
            Map.entry("SIERRA", "https://www.sierracounty.ca.gov/149/Assessor"),
            Map.entry("SISKIYOU", "https://www.co.siskiyou.ca.us/assessor"),
            Map.entry("SOLANO", "https://www.solanocounty.com/depts/assessor/"),
            Map.entry("SONOMA", "https://sonomacounty.ca.gov/administrative-support-and-fiscal-services/clerk-recorder-assessor-registrar-of-voters"),
            Map.entry("STANISLAUS", "https://www.stancounty.com/assessor/"),
            Map.entry("SUTTER", "https://www.suttercounty.org/government/county-departments/assessor"),
            Map.entry("TEHAMA", "https://www.tehamacountyca.gov/government/assessor"),
            Map.entry("TRINITY", "https://www.trinitycounty.org/Assessor"),
            Map.entry("TULARE", "https://tularecounty.ca.gov/assessor/"),
            Map.entry("TUOLUMNE", "https://www.tuolumnecounty.ca.gov/175/Assessor"),
            Map.entry("VENTURA", "https://assessor.countyofventura.org/"),
            Map.entry("YOLO", "https://www.yolocounty.org/government/general-government-departments/assessor"),
            Map.entry("YUBA", "https://www.yuba.org/departments/assessor/")
    );

    public static String carrierForAreaCode(String areaCode) {
        return areaCode == null ? null : AREA_CODE_CARRIERS.get(areaCode);
    }

    public static Coordinates coordinatesForState(String state) {
        return state == null ? null : STATE_COORDINATES.get(state);
    }

    public static String timezoneForState(String state) {
        return state == null ? null : STATE_TIMEZONES.get(state);
    }

    /**
     * Case-insensitive lookup of a California county assessor site.
     */
    public static String assessorUrlForCounty(String county) {
        return county == null ? null : CA_COUNTY_ASSESSORS.get(county.trim().toUpperCase(Locale.ROOT));
    }

    public static boolean isKnownRegion(String code) {
        return code != null && (STATE_TIMEZONES.containsKey(code) || STATE_COORDINATES.containsKey(code));
    }
}
