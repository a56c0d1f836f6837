package simboard.ingest;

import simboard.ingest.parsers.CaseDocsParser;
import simboard.ingest.parsers.CaseStatusParser;
import simboard.ingest.parsers.GitConfigParser;
import simboard.ingest.parsers.GitDescribeParser;
import simboard.ingest.parsers.GitStatusParser;
import simboard.ingest.parsers.ReadmeCaseParser;
import simboard.ingest.parsers.TimingFileParser;

import java.util.List;

/**
 * The files of an E3SM performance archive experiment directory. Parsers run in this order and later files
 * take precedence where two of them report the same field. The simulated period and run outcome come from
 * CaseStatus alone; the timing file's report date never stands in for a missing RUN_STARTDATE.
 */
public class FileSpecs {
    public static final String CASE_DOCS = "CaseDocs";

    private FileSpecs() {}

    public static List<FileSpec> defaults() {
        return List.of(
                FileSpec.root("e3sm_timing", "e3sm_timing\\..*\\..*", new TimingFileParser(), true),
                FileSpec.nested("readme_case", "README\\.case\\..*\\.gz", CASE_DOCS, new ReadmeCaseParser(), true),
                FileSpec.root("case_status", "CaseStatus\\..*\\.gz", new CaseStatusParser(), true)
                        .owning("simulation_start_date", "simulation_end_date", "run_start_date", "run_end_date",
                                "status"),
                FileSpec.nested("case_docs_env_case", "env_case\\.xml\\..*\\.gz", CASE_DOCS, CaseDocsParser.envCase(), false),
                FileSpec.nested("case_docs_env_build", "env_build\\.xml\\..*\\.gz", CASE_DOCS, CaseDocsParser.envBuild(), false),
                FileSpec.root("git_describe", "GIT_DESCRIBE\\..*\\.gz", new GitDescribeParser(), true),
                FileSpec.rootValue("git_config", "GIT_CONFIG\\..*\\.gz", new GitConfigParser(), "git_repository_url", false),
                FileSpec.rootValue("git_status", "GIT_STATUS\\..*\\.gz", new GitStatusParser(), "git_branch", false));
    }
}
